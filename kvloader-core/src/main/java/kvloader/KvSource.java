package kvloader;

import kvloader.cache.PendingBatches;
import kvloader.cache.ResultCache;
import kvloader.dispatch.BatchDispatcher;
import kvloader.exec.ExecutorTaskRunner;
import kvloader.spi.MetricsExporter;
import kvloader.spi.RunOptions;
import kvloader.spi.TaskRunner;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Key-value {@link Source} backed by a single {@link BatchLoadFunction}.
 *
 * <p>Lookups requested through {@link #load} and {@link #loadMany} are collected per batch
 * identifier. {@link #run()} calls the loader once per batch identifier, in parallel through
 * the configured {@link TaskRunner}, and caches every returned value. A failed batch caches
 * its error for every requested key, so the loader is not called again for those keys by
 * this instance.
 *
 * <pre>{@code
 * KvSource<String, Long, User> users = KvSource.create((table, ids) -> userDao.findByIds(ids));
 * users.load("users", 1L);
 * users.loadMany("users", List.of(2L, 3L));
 * users.run();
 * Result<User> first = users.fetch("users", 1L);
 * }</pre>
 *
 * <p>Create one instance per unit of work and discard it afterwards; cached results are
 * never evicted. This class is not thread-safe.
 *
 * @param <B> batch identifier type
 * @param <K> key type
 * @param <V> value type
 * @see KvSource.Builder
 */
public final class KvSource<B, K, V> implements Source<B, K, V> {
  private final PendingBatches<B, K> pending = new PendingBatches<>();
  private final ResultCache<B, K, V> cache = new ResultCache<>();
  private final BatchDispatcher<B, K, V> dispatcher;
  private final RunOptions runOptions;

  private KvSource(Builder<B, K, V> builder) {
    BatchLoadFunction<B, K, V> loader = Objects.requireNonNull(builder.loader, "loader");
    KvConfig config = builder.config.copy().validate();
    this.runOptions = new RunOptions(config.getMaxConcurrency(), config.getTimeoutMs());
    TaskRunner taskRunner = builder.taskRunner != null ? builder.taskRunner : new ExecutorTaskRunner();
    MetricsExporter metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.dispatcher = new BatchDispatcher<>(loader, taskRunner, runOptions, metrics);
  }

  /**
   * Creates a source with default settings.
   *
   * @param loader the bulk loader
   * @return a new source
   * @throws NullPointerException if {@code loader} is null
   */
  public static <B, K, V> KvSource<B, K, V> create(BatchLoadFunction<B, K, V> loader) {
    return builder(loader).build();
  }

  /**
   * Creates a source with the given settings.
   *
   * @param loader the bulk loader
   * @param config concurrency and timeout settings; copied
   * @return a new source
   * @throws NullPointerException     if {@code loader} or {@code config} is null
   * @throws IllegalArgumentException if {@code config} is invalid
   */
  public static <B, K, V> KvSource<B, K, V> create(BatchLoadFunction<B, K, V> loader, KvConfig config) {
    return builder(loader).config(config).build();
  }

  public static <B, K, V> Builder<B, K, V> builder(BatchLoadFunction<B, K, V> loader) {
    return new Builder<B, K, V>().loader(loader);
  }

  @Override
  public void load(B batch, K key) {
    if (key == null) {
      return;
    }
    if (!cache.contains(batch, key)) {
      pending.add(batch, key);
    }
  }

  @Override
  public void loadMany(B batch, Collection<? extends K> keys) {
    if (keys == null || keys.isEmpty()) {
      return;
    }
    Set<K> requested = new LinkedHashSet<>();
    for (K key : keys) {
      if (key != null) {
        requested.add(key);
      }
    }
    if (cache.containsBatch(batch)) {
      pending.addAll(batch, cache.missing(batch, requested));
    } else {
      // Nothing cached for this batch yet; skip the per-key probe.
      pending.addAll(batch, requested);
    }
  }

  @Override
  public void run() {
    dispatcher.dispatch(pending.drain(), cache);
  }

  @Override
  public Result<V> fetch(B batch, K key) {
    return cache.get(batch, key);
  }

  @Override
  public Result<List<V>> fetchMany(B batch, List<? extends K> keys) {
    if (keys == null || keys.isEmpty()) {
      return Result.ok(List.of());
    }
    List<V> values = new ArrayList<>(keys.size());
    for (K key : keys) {
      Result<V> result = cache.get(batch, key);
      if (result instanceof Result.Err<V> err) {
        return Result.err(err.error());
      }
      values.add(((Result.Ok<V>) result).value());
    }
    return Result.ok(Collections.unmodifiableList(values));
  }

  @Override
  public void put(B batch, K key, Result<V> result) {
    if (result == null) {
      return;
    }
    cache.put(batch, key, result);
  }

  @Override
  public boolean hasPendingBatches() {
    return !pending.isEmpty();
  }

  @Override
  public long timeoutMs() {
    return runOptions.timeoutMs();
  }

  public int maxConcurrency() {
    return runOptions.maxConcurrency();
  }

  /**
   * Returns the keys currently waiting for a run under {@code batch}.
   *
   * @return read-only view; empty if nothing is pending for the batch
   */
  public Set<K> pendingKeys(B batch) {
    return pending.keys(batch);
  }

  /** Builder for {@link KvSource}. */
  public static final class Builder<B, K, V> {
    private BatchLoadFunction<B, K, V> loader;
    private KvConfig config = KvConfig.defaults();
    private TaskRunner taskRunner;
    private MetricsExporter metrics;

    private Builder() {}

    /**
     * Sets the bulk loader.
     *
     * <p><b>Required.</b>
     *
     * @param loader the loader
     * @return this builder
     */
    public Builder<B, K, V> loader(BatchLoadFunction<B, K, V> loader) {
      this.loader = loader;
      return this;
    }

    /**
     * Replaces all settings with a copy of {@code config}.
     *
     * @param config the settings
     * @return this builder
     */
    public Builder<B, K, V> config(KvConfig config) {
      this.config = Objects.requireNonNull(config, "config").copy();
      return this;
    }

    /**
     * Sets how many batches may load in parallel during a run.
     *
     * <p>Optional. Defaults to twice the available processors. Must be &ge; 1.
     *
     * @param maxConcurrency parallel batch limit
     * @return this builder
     */
    public Builder<B, K, V> maxConcurrency(int maxConcurrency) {
      this.config.setMaxConcurrency(maxConcurrency);
      return this;
    }

    /**
     * Sets the wall-clock bound of a run in milliseconds.
     *
     * <p>Optional. Defaults to {@code 30000}. Must be &ge; 0.
     *
     * @param timeoutMs run timeout
     * @return this builder
     */
    public Builder<B, K, V> timeoutMs(long timeoutMs) {
      this.config.setTimeoutMs(timeoutMs);
      return this;
    }

    /**
     * Sets the task runner that executes batch loads.
     *
     * <p>Optional. Defaults to a new {@link ExecutorTaskRunner}.
     *
     * @param taskRunner the runner
     * @return this builder
     */
    public Builder<B, K, V> taskRunner(TaskRunner taskRunner) {
      this.taskRunner = taskRunner;
      return this;
    }

    /**
     * Sets the metrics exporter.
     *
     * <p>Optional. Defaults to {@link MetricsExporter#NOOP}.
     *
     * @param metrics the exporter
     * @return this builder
     */
    public Builder<B, K, V> metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /**
     * Builds the source.
     *
     * @return a new {@link KvSource}
     * @throws NullPointerException     if no loader was set
     * @throws IllegalArgumentException if {@code maxConcurrency < 1} or {@code timeoutMs < 0}
     */
    public KvSource<B, K, V> build() {
      return new KvSource<>(this);
    }
  }
}
