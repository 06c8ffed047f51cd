package kvloader.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import kvloader.spi.MetricsExporter;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <p>Registers counters and gauges with a {@link MeterRegistry}. One exporter is usually
 * shared by every source an application creates, so the counters aggregate across units
 * of work.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code kvloader.run}: runs that dispatched at least one batch</li>
 *   <li>{@code kvloader.batch.success}: batches whose loader returned values</li>
 *   <li>{@code kvloader.batch.failure}: batches that failed (loader error, timeout)</li>
 *   <li>{@code kvloader.keys.loaded}: key/value pairs returned by loaders</li>
 * </ul>
 *
 * <h3>Gauges</h3>
 * <ul>
 *   <li>{@code kvloader.run.duration.ms}: duration of the most recent run</li>
 *   <li>{@code kvloader.batches.pending}: batches pending when the most recent run started</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final Counter runs;
  private final Counter batchSuccess;
  private final Counter batchFailure;
  private final Counter keysLoaded;
  private final Gauge runDurationGauge;
  private final Gauge pendingBatchesGauge;

  private final AtomicLong lastRunDurationMs = new AtomicLong();
  private final AtomicInteger pendingBatches = new AtomicInteger();
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "kvloader"}.
   *
   * @param registry the Micrometer meter registry
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "kvloader");
  }

  /**
   * Creates an exporter with a custom metric name prefix.
   *
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "graphql.kvloader"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.runs = Counter.builder(namePrefix + ".run")
        .description("Runs that dispatched at least one batch")
        .register(registry);
    this.batchSuccess = Counter.builder(namePrefix + ".batch.success")
        .description("Batches loaded successfully")
        .register(registry);
    this.batchFailure = Counter.builder(namePrefix + ".batch.failure")
        .description("Batches failed (loader error, timeout, runner failure)")
        .register(registry);
    this.keysLoaded = Counter.builder(namePrefix + ".keys.loaded")
        .description("Keys resolved by loaders")
        .register(registry);

    this.runDurationGauge = Gauge.builder(namePrefix + ".run.duration.ms", lastRunDurationMs, AtomicLong::get)
        .register(registry);
    this.pendingBatchesGauge = Gauge.builder(namePrefix + ".batches.pending", pendingBatches, AtomicInteger::get)
        .register(registry);
  }

  @Override
  public void incrementRuns() {
    if (closed) return;
    runs.increment();
  }

  @Override
  public void incrementBatchSuccess() {
    if (closed) return;
    batchSuccess.increment();
  }

  @Override
  public void incrementBatchFailure() {
    if (closed) return;
    batchFailure.increment();
  }

  @Override
  public void recordKeysLoaded(int count) {
    if (closed) return;
    keysLoaded.increment(count);
  }

  @Override
  public void recordRunDurationMs(long durationMs) {
    if (closed) return;
    lastRunDurationMs.set(durationMs);
  }

  @Override
  public void recordPendingBatches(int count) {
    if (closed) return;
    pendingBatches.set(count);
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    RuntimeException first = null;
    for (Meter meter : List.of(runs, batchSuccess, batchFailure, keysLoaded,
        runDurationGauge, pendingBatchesGauge)) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
