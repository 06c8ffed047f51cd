package kvloader;

import java.util.Collection;
import java.util.List;

/**
 * A batching data source driven by an orchestration layer.
 *
 * <p>Callers register interest with {@link #load} / {@link #loadMany}, trigger fetching
 * with {@link #run}, then read with {@link #fetch} / {@link #fetchMany}. Keys that are
 * already cached (as a value or as an error) are never requested again.
 *
 * <p>Implementations are single-owner: no method may be called concurrently with another
 * on the same instance.
 *
 * @param <B> batch identifier type
 * @param <K> key type
 * @param <V> value type
 */
public interface Source<B, K, V> {

  /**
   * Marks {@code key} as wanted under {@code batch} unless it is already cached.
   * A {@code null} key is ignored.
   */
  void load(B batch, K key);

  /**
   * Marks every uncached key as wanted under {@code batch}. A {@code null} or empty
   * collection is ignored.
   */
  void loadMany(B batch, Collection<? extends K> keys);

  /**
   * Loads every pending batch and merges the outcomes into the cache. Blocks until the
   * task runner returns. Batch failures are cached as errors; this method does not throw
   * for them.
   */
  void run();

  /**
   * Reads one cached key.
   *
   * @return the value, the cached error, {@link LoadError.NotFound} or
   *     {@link LoadError.UnknownBatch}
   */
  Result<V> fetch(B batch, K key);

  /**
   * Reads keys in order, stopping at the first key that is not an {@link Result.Ok}.
   *
   * @return all values in input order, or the first error encountered
   */
  Result<List<V>> fetchMany(B batch, List<? extends K> keys);

  /**
   * Seeds the cache directly, bypassing the loader. A {@code null} result is ignored.
   */
  void put(B batch, K key, Result<V> result);

  /**
   * Returns {@code true} if a {@link #run()} would call the loader.
   */
  boolean hasPendingBatches();

  /**
   * Returns the wall-clock bound, in milliseconds, applied to each {@link #run()}.
   */
  long timeoutMs();
}
