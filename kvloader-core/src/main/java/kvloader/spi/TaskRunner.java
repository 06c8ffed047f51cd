package kvloader.spi;

import kvloader.dispatch.BatchOutcome;
import kvloader.dispatch.BatchTask;

import java.util.List;

/**
 * Executes the per-batch loader tasks of one run.
 *
 * <p>Implementations decide how tasks are scheduled (caller thread, thread pool, ...)
 * but must honor {@link RunOptions#maxConcurrency()} as an upper bound and stop waiting
 * once {@link RunOptions#timeoutMs()} has elapsed.
 *
 * <p>The returned list holds exactly one outcome per task, in task order. Tasks that did
 * not complete (timeout, cancellation, crash) are reported as failed outcomes rather than
 * omitted.
 */
public interface TaskRunner {

  <B, K, V> List<BatchOutcome<B, K, V>> runAll(List<BatchTask<B, K, V>> tasks, RunOptions options);
}
