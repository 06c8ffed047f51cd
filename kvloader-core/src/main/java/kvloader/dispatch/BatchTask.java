package kvloader.dispatch;

import kvloader.BatchLoadFunction;
import kvloader.LoadError;
import kvloader.Result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Unit of work that loads one batch. Never throws: anything the loader throws, {@link Error}s
 * included, and {@code null} returns become a failed {@link BatchOutcome}.
 */
public final class BatchTask<B, K, V> implements Callable<BatchOutcome<B, K, V>> {
  private final B batch;
  private final Set<K> keys;
  private final BatchLoadFunction<B, K, V> loader;

  public BatchTask(B batch, Set<K> keys, BatchLoadFunction<B, K, V> loader) {
    this.batch = Objects.requireNonNull(batch, "batch");
    this.keys = Collections.unmodifiableSet(new LinkedHashSet<>(Objects.requireNonNull(keys, "keys")));
    this.loader = Objects.requireNonNull(loader, "loader");
  }

  public B batch() {
    return batch;
  }

  public Set<K> keys() {
    return keys;
  }

  @Override
  public BatchOutcome<B, K, V> call() {
    Map<K, V> values;
    try {
      values = loader.load(batch, keys);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return BatchOutcome.failed(this, LoadError.failed("interrupted", e));
    } catch (Throwable t) {
      return BatchOutcome.failed(this, LoadError.failed(reasonOf(t), t));
    }
    if (values == null) {
      return BatchOutcome.failed(this, LoadError.failed("loader returned null for batch " + batch));
    }
    return new BatchOutcome<>(batch, keys, Result.ok(new LinkedHashMap<>(values)));
  }

  static String reasonOf(Throwable t) {
    String message = t.getMessage();
    return message != null ? message : t.getClass().getName();
  }

  @Override
  public String toString() {
    return "BatchTask{batch=" + batch + ", keys=" + keys.size() + "}";
  }
}
