package uk.ac.ebi.biostudies.index_core.gc;

import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Process-wide snapshot loading flag, set by whoever restores index data at startup. */
@Slf4j
@Component
public class SnapshotLoadState implements SnapshotLoadingProbe {

  private final AtomicBoolean loading = new AtomicBoolean();

  public void beginLoad() {
    loading.set(true);
    log.info("Snapshot loading started");
  }

  public void endLoad() {
    loading.set(false);
    log.info("Snapshot loading finished");
  }

  @Override
  public boolean isLoading() {
    return loading.get();
  }
}
