package uk.ac.ebi.biostudies.index_core.gc;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs a {@link GarbageCollector} on its own single-thread scheduler. After each cycle the next one
 * is scheduled {@link GarbageCollector#getInterval()} later, so the delay follows the collector's
 * current frequency.
 *
 * <p>The task stops when asked to, when a cycle reports {@link GcStatus#INDEX_INVALID}, or when a
 * cycle throws.
 */
@Slf4j
public class GarbageCollectorTask {

  @Getter private final GarbageCollector collector;
  private final ScheduledThreadPoolExecutor scheduler;
  private final AtomicBoolean running = new AtomicBoolean();

  public GarbageCollectorTask(GarbageCollector collector) {
    this.collector = collector;
    this.scheduler =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              Thread t = new Thread(r, "gc-" + collector.getIndexName());
              t.setDaemon(true);
              return t;
            });
    // a pending cycle is dropped on stop
    scheduler.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
  }

  public void start() {
    if (running.compareAndSet(false, true)) {
      log.info(
          "Starting GC for index {} at {} hz", collector.getIndexName(), collector.getHz());
      scheduleNext();
    }
  }

  /** Stops the task. A cycle in progress runs to completion first. */
  public void stop() {
    if (running.compareAndSet(true, false)) {
      collector.onTerm();
      scheduler.shutdown();
      log.info("GC for index {} stopped", collector.getIndexName());
    }
  }

  public boolean isRunning() {
    return running.get();
  }

  void runCycle() {
    if (!running.get()) {
      return;
    }
    GcStatus status;
    try {
      status = collector.periodicCallback();
    } catch (RuntimeException e) {
      log.error("GC for index {} terminated abnormally", collector.getIndexName(), e);
      stop();
      return;
    }
    if (status == GcStatus.INDEX_INVALID) {
      log.warn("Index {} is no longer valid, stopping its GC", collector.getIndexName());
      stop();
      return;
    }
    scheduleNext();
  }

  private void scheduleNext() {
    if (!running.get()) {
      return;
    }
    try {
      scheduler.schedule(this::runCycle, collector.getInterval().toNanos(), TimeUnit.NANOSECONDS);
    } catch (RejectedExecutionException e) {
      log.debug("GC scheduler for {} already shut down", collector.getIndexName());
    }
  }
}
