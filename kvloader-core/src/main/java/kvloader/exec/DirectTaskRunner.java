package kvloader.exec;

import kvloader.LoadError;
import kvloader.dispatch.BatchOutcome;
import kvloader.dispatch.BatchTask;
import kvloader.spi.RunOptions;
import kvloader.spi.TaskRunner;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs batch tasks one after another on the calling thread.
 *
 * <p>Deterministic: tasks execute in order and {@link RunOptions#maxConcurrency()} is
 * irrelevant. The timeout is checked before each task starts; tasks that would start after
 * the deadline are reported as timed out. A task that is already running is not
 * interrupted.
 */
public final class DirectTaskRunner implements TaskRunner {

  public static final DirectTaskRunner INSTANCE = new DirectTaskRunner();

  @Override
  public <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options) {
    long start = System.nanoTime();
    long timeoutNanos = TimeUnit.MILLISECONDS.toNanos(options.timeoutMs());
    List<BatchOutcome<B, K, V>> outcomes = new ArrayList<>(tasks.size());
    for (BatchTask<B, K, V> task : tasks) {
      if (System.nanoTime() - start >= timeoutNanos) {
        outcomes.add(BatchOutcome.failed(task,
            LoadError.failed("timeout after " + options.timeoutMs() + "ms")));
      } else {
        outcomes.add(task.call());
      }
    }
    return outcomes;
  }
}
