package kvloader.cache;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Keys awaiting a fetch, grouped by batch identifier.
 *
 * <p>Set semantics per batch: adding a key twice keeps one copy. A batch entry exists only
 * while it holds at least one key. Insertion order of batches and keys is preserved.
 *
 * <p>Not thread-safe.
 */
public final class PendingBatches<B, K> {
  private Map<B, Set<K>> batches = new LinkedHashMap<>();

  public void add(B batch, K key) {
    Objects.requireNonNull(batch, "batch");
    batches.computeIfAbsent(batch, b -> new LinkedHashSet<>()).add(key);
  }

  /**
   * Adds every key in {@code keys} to {@code batch}. An empty collection leaves no entry.
   */
  public void addAll(B batch, Collection<? extends K> keys) {
    Objects.requireNonNull(batch, "batch");
    if (keys.isEmpty()) {
      return;
    }
    batches.computeIfAbsent(batch, b -> new LinkedHashSet<>()).addAll(keys);
  }

  public boolean isEmpty() {
    return batches.isEmpty();
  }

  public int size() {
    return batches.size();
  }

  /**
   * Returns a read-only view of the keys pending for {@code batch}; empty if none.
   */
  public Set<K> keys(B batch) {
    Set<K> keys = batches.get(batch);
    return keys == null ? Collections.emptySet() : Collections.unmodifiableSet(keys);
  }

  /**
   * Removes and returns everything pending. This tracker is empty afterwards.
   */
  public Map<B, Set<K>> drain() {
    Map<B, Set<K>> drained = batches;
    batches = new LinkedHashMap<>();
    return drained;
  }
}
