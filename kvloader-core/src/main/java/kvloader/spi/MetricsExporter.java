package kvloader.spi;

/**
 * Observability hook for exporting run counters and gauges to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

  /**
   * No-op instance that discards all metrics.
   */
  MetricsExporter NOOP = new Noop();

  /**
   * Increments the count of runs that dispatched at least one batch.
   */
  void incrementRuns();

  /**
   * Increments the count of batches whose loader returned values.
   */
  void incrementBatchSuccess();

  /**
   * Increments the count of batches that failed (loader error, timeout, runner failure).
   */
  void incrementBatchFailure();

  /**
   * Records the number of key/value pairs a successful batch produced.
   *
   * @param count number of keys resolved
   */
  void recordKeysLoaded(int count);

  /**
   * Records the wall-clock duration of a run.
   *
   * @param durationMs duration in milliseconds (always non-negative)
   */
  void recordRunDurationMs(long durationMs);

  /**
   * Records how many batches were pending when a run started.
   *
   * @param count pending batch count
   */
  default void recordPendingBatches(int count) {
  }

  /**
   * Default no-op implementation that discards all metrics.
   */
  final class Noop implements MetricsExporter {
    @Override
    public void incrementRuns() {
    }

    @Override
    public void incrementBatchSuccess() {
    }

    @Override
    public void incrementBatchFailure() {
    }

    @Override
    public void recordKeysLoaded(int count) {
    }

    @Override
    public void recordRunDurationMs(long durationMs) {
    }
  }
}
