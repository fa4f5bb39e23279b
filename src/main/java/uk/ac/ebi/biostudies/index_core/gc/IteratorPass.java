package uk.ac.ebi.biostudies.index_core.gc;

/**
 * Pass of a numeric tree iterator within one search for a node. An iterator that runs dry on its
 * {@link #FRESH} pass is restarted once; running dry again on the {@link #RESTARTED} pass means the
 * tree holds no range at all, which cannot happen for a well-formed tree.
 */
public enum IteratorPass {
  FRESH,
  RESTARTED
}
