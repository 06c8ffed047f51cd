package kvloader;

import kvloader.exec.ExecutorTaskRunner;
import kvloader.spi.MetricsExporter;
import kvloader.spi.TaskRunner;

import java.util.Objects;

/**
 * Creates {@link KvSource} instances that share one task runner, metrics exporter and
 * set of settings.
 *
 * <p>Sources are meant to live for a single unit of work; the factory is the long-lived
 * piece an application wires once. This class is thread-safe.
 */
public final class KvSourceFactory {
  private final TaskRunner taskRunner;
  private final MetricsExporter metrics;
  private final KvConfig config;

  public KvSourceFactory() {
    this(new ExecutorTaskRunner(), MetricsExporter.NOOP, KvConfig.defaults());
  }

  /**
   * @param taskRunner runner shared by every created source
   * @param metrics    exporter shared by every created source
   * @param config     settings; copied and validated
   * @throws IllegalArgumentException if {@code config} is invalid
   */
  public KvSourceFactory(TaskRunner taskRunner, MetricsExporter metrics, KvConfig config) {
    this.taskRunner = Objects.requireNonNull(taskRunner, "taskRunner");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.config = Objects.requireNonNull(config, "config").copy().validate();
  }

  /**
   * Creates a fresh source with an empty cache.
   *
   * @param loader the bulk loader
   * @return a new source
   */
  public <B, K, V> KvSource<B, K, V> create(BatchLoadFunction<B, K, V> loader) {
    return KvSource.builder(loader)
        .config(config)
        .taskRunner(taskRunner)
        .metrics(metrics)
        .build();
  }

  public TaskRunner taskRunner() {
    return taskRunner;
  }

  public int maxConcurrency() {
    return config.getMaxConcurrency();
  }

  public long timeoutMs() {
    return config.getTimeoutMs();
  }
}
