package kvloader.dispatch;

import kvloader.LoadError;
import kvloader.RecordingMetrics;
import kvloader.Result;
import kvloader.cache.ResultCache;
import kvloader.exec.DirectTaskRunner;
import kvloader.spi.RunOptions;
import kvloader.spi.TaskRunner;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class BatchDispatcherTest {

  private static final RunOptions OPTIONS = new RunOptions(4, 1_000);

  private final ResultCache<String, Integer, String> cache = new ResultCache<>();
  private final RecordingMetrics metrics = new RecordingMetrics();

  private static Map<String, Set<Integer>> pending(Object... batchAndKeys) {
    Map<String, Set<Integer>> pending = new LinkedHashMap<>();
    for (int i = 0; i < batchAndKeys.length; i += 2) {
      @SuppressWarnings("unchecked")
      Set<Integer> keys = (Set<Integer>) batchAndKeys[i + 1];
      pending.put((String) batchAndKeys[i], keys);
    }
    return pending;
  }

  private BatchDispatcher<String, Integer, String> dispatcher(TaskRunner runner) {
    return new BatchDispatcher<>((batch, keys) -> {
      Map<Integer, String> values = new LinkedHashMap<>();
      keys.forEach(k -> values.put(k, batch + k));
      return values;
    }, runner, OPTIONS, metrics);
  }

  @Test
  void constructorRejectsNulls() {
    assertThrows(NullPointerException.class, () ->
        new BatchDispatcher<String, Integer, String>(null, DirectTaskRunner.INSTANCE, OPTIONS, metrics));
    assertThrows(NullPointerException.class, () ->
        new BatchDispatcher<String, Integer, String>((b, k) -> Map.of(), null, OPTIONS, metrics));
  }

  @Test
  void emptyPendingSkipsRunner() {
    AtomicInteger invocations = new AtomicInteger();
    TaskRunner runner = new TaskRunner() {
      @Override
      public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
        invocations.incrementAndGet();
        return List.of();
      }
    };

    dispatcher(runner).dispatch(Map.of(), cache);

    assertEquals(0, invocations.get());
    assertEquals(0, metrics.runs.get());
    assertEquals(0, metrics.lastPendingBatches.get());
  }

  @Test
  void passesOneTaskPerBatchAndRunOptions() {
    AtomicReference<List<String>> batches = new AtomicReference<>();
    AtomicReference<RunOptions> seenOptions = new AtomicReference<>();
    TaskRunner runner = new TaskRunner() {
      @Override
      public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
        List<String> names = new ArrayList<>();
        tasks.forEach(t -> names.add(String.valueOf(t.batch())));
        batches.set(names);
        seenOptions.set(options);
        return DirectTaskRunner.INSTANCE.runAll(tasks, options);
      }
    };

    dispatcher(runner).dispatch(pending("users", Set.of(1), "posts", Set.of(2)), cache);

    assertEquals(List.of("users", "posts"), batches.get());
    assertEquals(OPTIONS, seenOptions.get());
    assertEquals(Result.ok("users1"), cache.get("users", 1));
    assertEquals(Result.ok("posts2"), cache.get("posts", 2));
  }

  @Test
  void throwingRunnerFailsEveryBatch() {
    TaskRunner runner = new TaskRunner() {
      @Override
      public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
        throw new IllegalStateException("pool exhausted");
      }
    };

    dispatcher(runner).dispatch(pending("users", Set.of(1, 2), "posts", Set.of(3)), cache);

    for (var read : List.of(cache.get("users", 1), cache.get("users", 2), cache.get("posts", 3))) {
      var err = assertInstanceOf(Result.Err.class, read);
      assertEquals("pool exhausted", err.error().message());
    }
    assertEquals(2, metrics.batchFailure.get());
    assertEquals(1, metrics.runs.get());
  }

  @Test
  void runnerThrowingErrorFailsEveryBatch() {
    TaskRunner runner = new TaskRunner() {
      @Override
      public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
        throw new NoClassDefFoundError("com/example/Driver");
      }
    };

    dispatcher(runner).dispatch(pending("users", Set.of(1)), cache);

    var err = assertInstanceOf(Result.Err.class, cache.get("users", 1));
    var failed = assertInstanceOf(LoadError.Failed.class, err.error());
    assertEquals("com/example/Driver", failed.reason());
    assertInstanceOf(NoClassDefFoundError.class, failed.cause());
    assertEquals(1, metrics.batchFailure.get());
  }

  @Test
  void batchMissingFromRunnerResultFails() {
    TaskRunner runner = new TaskRunner() {
      @Override
      public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
        return List.of(tasks.get(0).call());
      }
    };

    dispatcher(runner).dispatch(pending("users", Set.of(1), "posts", Set.of(2)), cache);

    assertEquals(Result.ok("users1"), cache.get("users", 1));
    var err = assertInstanceOf(Result.Err.class, cache.get("posts", 2));
    assertInstanceOf(LoadError.Failed.class, err.error());
    assertEquals("no outcome reported for batch posts", err.error().message());
  }

  @Test
  void nullRunnerResultFailsEveryBatch() {
    TaskRunner runner = new TaskRunner() {
      @Override
      public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
        return null;
      }
    };

    dispatcher(runner).dispatch(pending("users", Set.of(1)), cache);

    assertInstanceOf(LoadError.Failed.class, ((Result.Err<String>) cache.get("users", 1)).error());
  }

  @Test
  void duplicateOutcomeForBatchKeepsFirst() {
    TaskRunner runner = new TaskRunner() {
      @Override
      public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
        BatchTask<B, K, V> task = tasks.get(0);
        return List.of(task.call(), BatchOutcome.failed(task, LoadError.failed("late")));
      }
    };

    dispatcher(runner).dispatch(pending("users", Set.of(1)), cache);

    assertEquals(Result.ok("users1"), cache.get("users", 1));
    assertEquals(1, metrics.batchSuccess.get());
    assertEquals(0, metrics.batchFailure.get());
  }

  @Test
  void recordsKeysLoadedAndPendingBatches() {
    dispatcher(DirectTaskRunner.INSTANCE)
        .dispatch(pending("users", Set.of(1, 2, 3), "posts", Set.of(4)), cache);

    assertEquals(4, metrics.keysLoaded.get());
    assertEquals(2, metrics.batchSuccess.get());
    assertEquals(2, metrics.lastPendingBatches.get());
  }
}
