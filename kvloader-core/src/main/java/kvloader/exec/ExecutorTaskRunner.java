package kvloader.exec;

import kvloader.LoadError;
import kvloader.dispatch.BatchOutcome;
import kvloader.dispatch.BatchTask;
import kvloader.spi.RunOptions;
import kvloader.spi.TaskRunner;
import kvloader.util.DaemonThreadFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs batch tasks in parallel on a thread pool bounded by
 * {@link RunOptions#maxConcurrency()}.
 *
 * <p>Each run gets its own pool of {@code min(maxConcurrency, tasks)} daemon threads; extra
 * tasks queue. The calling thread blocks for at most {@link RunOptions#timeoutMs()}. Tasks
 * still queued or running at the deadline are cancelled and reported as
 * {@code Failed("timeout after <n>ms")}. If the calling thread is interrupted, unfinished
 * tasks are reported as {@code Failed("interrupted")} and the interrupt flag is restored.
 *
 * <p>This class is stateless and thread-safe; one instance can serve many sources.
 */
public final class ExecutorTaskRunner implements TaskRunner {
  private static final Logger logger = Logger.getLogger(ExecutorTaskRunner.class.getName());

  public static final String DEFAULT_THREAD_PREFIX = "kvloader-loader-";

  private final String threadPrefix;

  public ExecutorTaskRunner() {
    this(DEFAULT_THREAD_PREFIX);
  }

  /**
   * @param threadPrefix name prefix for worker threads
   */
  public ExecutorTaskRunner(String threadPrefix) {
    this.threadPrefix = Objects.requireNonNull(threadPrefix, "threadPrefix");
  }

  @Override
  public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
    if (tasks.isEmpty()) {
      return List.of();
    }
    int poolSize = Math.min(options.maxConcurrency(), tasks.size());
    ExecutorService pool = Executors.newFixedThreadPool(poolSize, new DaemonThreadFactory(threadPrefix));
    try {
      List<Future<BatchOutcome<B, K, V>>> futures;
      try {
        futures = pool.invokeAll(tasks, options.timeoutMs(), TimeUnit.MILLISECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        logger.log(Level.WARNING, "Interrupted while waiting for " + tasks.size() + " batch task(s)");
        LoadError error = LoadError.failed("interrupted", e);
        List<BatchOutcome<B, K, V>> failed = new ArrayList<>(tasks.size());
        for (BatchTask<B, K, V> task : tasks) {
          failed.add(BatchOutcome.failed(task, error));
        }
        return failed;
      }

      List<BatchOutcome<B, K, V>> outcomes = new ArrayList<>(tasks.size());
      int timedOut = 0;
      for (int i = 0; i < tasks.size(); i++) {
        BatchTask<B, K, V> task = tasks.get(i);
        Future<BatchOutcome<B, K, V>> future = futures.get(i);
        if (future.isCancelled()) {
          timedOut++;
          outcomes.add(BatchOutcome.failed(task, timeoutError(options)));
        } else {
          outcomes.add(collect(task, future, options));
        }
      }
      if (timedOut > 0) {
        logger.warning(timedOut + " of " + tasks.size()
            + " batch task(s) timed out after " + options.timeoutMs() + "ms");
      }
      return outcomes;
    } finally {
      pool.shutdownNow();
    }
  }

  private static <B, K, V> BatchOutcome<B, K, V> collect(BatchTask<B, K, V> task,
      Future<BatchOutcome<B, K, V>> future, RunOptions options) {
    try {
      return future.get();
    } catch (CancellationException e) {
      return BatchOutcome.failed(task, timeoutError(options));
    } catch (ExecutionException e) {
      Throwable cause = e.getCause() != null ? e.getCause() : e;
      String message = cause.getMessage();
      return BatchOutcome.failed(task,
          LoadError.failed(message != null ? message : cause.getClass().getName(), cause));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return BatchOutcome.failed(task, LoadError.failed("interrupted", e));
    }
  }

  private static LoadError timeoutError(RunOptions options) {
    return LoadError.failed("timeout after " + options.timeoutMs() + "ms");
  }
}
