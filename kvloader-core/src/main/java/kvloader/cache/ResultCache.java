package kvloader.cache;

import kvloader.LoadError;
import kvloader.Result;
import kvloader.dispatch.BatchOutcome;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Resolved lookups, keyed by batch identifier then key.
 *
 * <p>Entries are never evicted. Merging unions at the batch level and overwrites at the
 * key level: keys not mentioned by a merge keep their prior result.
 *
 * <p>Not thread-safe.
 */
public final class ResultCache<B, K, V> {
  private final Map<B, Map<K, Result<V>>> results = new HashMap<>();

  /**
   * Looks up one key.
   *
   * @return the cached result, {@link LoadError.NotFound} if the batch is known but the key
   *     is not, or {@link LoadError.UnknownBatch} if the batch is unknown
   */
  public Result<V> get(B batch, K key) {
    Map<K, Result<V>> batchResults = results.get(batch);
    if (batchResults == null) {
      return Result.err(LoadError.unknownBatch(batch));
    }
    Result<V> result = batchResults.get(key);
    return result != null ? result : Result.err(LoadError.notFound());
  }

  public boolean containsBatch(B batch) {
    return results.containsKey(batch);
  }

  /**
   * Returns {@code true} if {@code key} has a cached result (value or error).
   */
  public boolean contains(B batch, K key) {
    Map<K, Result<V>> batchResults = results.get(batch);
    return batchResults != null && batchResults.containsKey(key);
  }

  public void put(B batch, K key, Result<V> result) {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(result, "result");
    batchResults(batch).put(key, result);
  }

  /**
   * Merges a loader outcome. On success every returned pair is cached as
   * {@link Result.Ok}; requested keys the loader left out stay uncached. On failure the
   * error is written to every requested key.
   */
  public void merge(BatchOutcome<B, K, V> outcome) {
    Map<K, Result<V>> batchResults = batchResults(outcome.batch());
    Result<Map<K, V>> result = outcome.result();
    if (result instanceof Result.Ok<Map<K, V>> ok) {
      for (Map.Entry<K, V> entry : ok.value().entrySet()) {
        batchResults.put(entry.getKey(), Result.ok(entry.getValue()));
      }
    } else if (result instanceof Result.Err<Map<K, V>> err) {
      Result<V> failure = Result.err(err.error());
      for (K key : outcome.requestedKeys()) {
        batchResults.put(key, failure);
      }
    }
  }

  /**
   * Returns the subset of {@code keys} that has no cached result under {@code batch}.
   */
  public Set<K> missing(B batch, Collection<? extends K> keys) {
    Map<K, Result<V>> batchResults = results.getOrDefault(batch, Collections.emptyMap());
    Set<K> missing = new LinkedHashSet<>();
    for (K key : keys) {
      if (!batchResults.containsKey(key)) {
        missing.add(key);
      }
    }
    return missing;
  }

  public int batchCount() {
    return results.size();
  }

  private Map<K, Result<V>> batchResults(B batch) {
    return results.computeIfAbsent(batch, b -> new HashMap<>());
  }
}
