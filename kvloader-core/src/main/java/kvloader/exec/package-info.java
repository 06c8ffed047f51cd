/**
 * Built-in {@link kvloader.spi.TaskRunner} implementations.
 *
 * <p>{@link kvloader.exec.ExecutorTaskRunner} is the production default;
 * {@link kvloader.exec.DirectTaskRunner} runs on the caller thread and suits tests and
 * single-threaded hosts.
 */
package kvloader.exec;
