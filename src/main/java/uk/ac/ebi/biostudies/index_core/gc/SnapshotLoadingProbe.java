package uk.ac.ebi.biostudies.index_core.gc;

/** Tells collectors whether index data is still being restored from a snapshot. */
@FunctionalInterface
public interface SnapshotLoadingProbe {

  boolean isLoading();
}
