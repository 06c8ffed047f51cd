package kvloader.dispatch;

import kvloader.BatchLoadFunction;
import kvloader.LoadError;
import kvloader.Result;
import kvloader.cache.ResultCache;
import kvloader.spi.MetricsExporter;
import kvloader.spi.RunOptions;
import kvloader.spi.TaskRunner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns drained pending batches into loader calls and merges what comes back.
 *
 * <p>One {@link BatchTask} is built per batch identifier and handed to the
 * {@link TaskRunner}. The runner's answer is reconciled against the requested batches
 * before merging: a batch the runner did not report on, or every batch if the runner
 * throws, is recorded as {@link LoadError.Failed}. A dispatch therefore never throws for
 * loader or runner failures.
 *
 * <p>Not thread-safe; owned by a single source.
 */
public final class BatchDispatcher<B, K, V> {
  private static final Logger logger = Logger.getLogger(BatchDispatcher.class.getName());

  private final BatchLoadFunction<B, K, V> loader;
  private final TaskRunner taskRunner;
  private final RunOptions runOptions;
  private final MetricsExporter metrics;

  public BatchDispatcher(BatchLoadFunction<B, K, V> loader, TaskRunner taskRunner,
      RunOptions runOptions, MetricsExporter metrics) {
    this.loader = Objects.requireNonNull(loader, "loader");
    this.taskRunner = Objects.requireNonNull(taskRunner, "taskRunner");
    this.runOptions = Objects.requireNonNull(runOptions, "runOptions");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Loads every batch in {@code pending} and merges the outcomes into {@code cache}.
   *
   * @param pending batch identifier to keys, as drained from the request tracker
   * @param cache   cache receiving the outcomes
   */
  public void dispatch(Map<B, Set<K>> pending, ResultCache<B, K, V> cache) {
    metrics.recordPendingBatches(pending.size());
    if (pending.isEmpty()) {
      return;
    }
    long start = System.nanoTime();
    logger.log(Level.FINE, "Dispatching {0} batch(es)", pending.size());

    List<BatchTask<B, K, V>> tasks = new ArrayList<>(pending.size());
    for (Map.Entry<B, Set<K>> entry : pending.entrySet()) {
      tasks.add(new BatchTask<>(entry.getKey(), entry.getValue(), loader));
    }

    for (BatchOutcome<B, K, V> outcome : execute(tasks)) {
      record(outcome);
      cache.merge(outcome);
    }

    long durationMs = (System.nanoTime() - start) / 1_000_000L;
    metrics.incrementRuns();
    metrics.recordRunDurationMs(durationMs);
    logger.log(Level.FINE, "Dispatch of {0} batch(es) finished in {1}ms",
        new Object[] {tasks.size(), durationMs});
  }

  private List<BatchOutcome<B, K, V>> execute(List<BatchTask<B, K, V>> tasks) {
    List<BatchOutcome<B, K, V>> reported;
    try {
      reported = taskRunner.runAll(Collections.unmodifiableList(tasks), runOptions);
    } catch (Throwable t) {
      logger.log(Level.SEVERE, "Task runner failed; failing all " + tasks.size() + " batch(es)", t);
      LoadError error = LoadError.failed(BatchTask.reasonOf(t), t);
      List<BatchOutcome<B, K, V>> failed = new ArrayList<>(tasks.size());
      for (BatchTask<B, K, V> task : tasks) {
        failed.add(BatchOutcome.failed(task, error));
      }
      return failed;
    }
    return reconcile(tasks, reported == null ? List.of() : reported);
  }

  // One outcome per task, in task order; unreported batches fail.
  private List<BatchOutcome<B, K, V>> reconcile(List<BatchTask<B, K, V>> tasks,
      List<BatchOutcome<B, K, V>> reported) {
    Map<B, BatchOutcome<B, K, V>> byBatch = new LinkedHashMap<>();
    for (BatchOutcome<B, K, V> outcome : reported) {
      if (outcome != null) {
        byBatch.putIfAbsent(outcome.batch(), outcome);
      }
    }
    List<BatchOutcome<B, K, V>> result = new ArrayList<>(tasks.size());
    for (BatchTask<B, K, V> task : tasks) {
      BatchOutcome<B, K, V> outcome = byBatch.get(task.batch());
      if (outcome == null) {
        logger.severe("Task runner reported no outcome for batch " + task.batch());
        outcome = BatchOutcome.failed(task,
            LoadError.failed("no outcome reported for batch " + task.batch()));
      }
      result.add(outcome);
    }
    return result;
  }

  private void record(BatchOutcome<B, K, V> outcome) {
    Result<Map<K, V>> result = outcome.result();
    if (result instanceof Result.Ok<Map<K, V>> ok) {
      metrics.incrementBatchSuccess();
      metrics.recordKeysLoaded(ok.value().size());
    } else if (result instanceof Result.Err<Map<K, V>> err) {
      metrics.incrementBatchFailure();
      LoadError error = err.error();
      Throwable cause = error instanceof LoadError.Failed failed ? failed.cause() : null;
      logger.log(Level.WARNING, "Batch " + outcome.batch() + " failed for "
          + outcome.requestedKeys().size() + " key(s): " + error.message(), cause);
    }
  }
}
