package kvloader.dispatch;

import kvloader.LoadError;
import kvloader.Result;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Result of loading one batch: the keys that were requested and what the loader produced.
 *
 * @param batch         batch identifier
 * @param requestedKeys keys handed to the loader
 * @param result        values keyed by key, or the batch-wide error
 */
public record BatchOutcome<B, K, V>(B batch, Set<K> requestedKeys, Result<Map<K, V>> result) {
  public BatchOutcome {
    Objects.requireNonNull(batch, "batch");
    Objects.requireNonNull(requestedKeys, "requestedKeys");
    Objects.requireNonNull(result, "result");
  }

  public static <B, K, V> BatchOutcome<B, K, V> failed(BatchTask<B, K, V> task, LoadError error) {
    return new BatchOutcome<>(task.batch(), task.keys(), Result.err(error));
  }
}
