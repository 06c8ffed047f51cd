/**
 * Batch dispatch: per-batch loader tasks and outcome merging.
 *
 * <p>{@link kvloader.dispatch.BatchDispatcher} builds one {@link kvloader.dispatch.BatchTask}
 * per pending batch identifier, runs them through a {@link kvloader.spi.TaskRunner}, and
 * merges each {@link kvloader.dispatch.BatchOutcome} into the result cache.
 *
 * @see kvloader.dispatch.BatchDispatcher
 */
package kvloader.dispatch;
