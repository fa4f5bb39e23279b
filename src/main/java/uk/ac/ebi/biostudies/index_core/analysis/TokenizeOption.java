package uk.ac.ebi.biostudies.index_core.analysis;

/** Per-field switches that alter the full-text analysis chain. */
public enum TokenizeOption {
  /** Index tokens as written, without adding stemmed forms. */
  NO_STEM,
  /** Add phonetic encodings of each token at the same position. */
  PHONETICS
}
