/**
 * Service provider interfaces for pluggable execution and metrics.
 *
 * <ul>
 *   <li>{@link kvloader.spi.TaskRunner}: runs the per-batch loader tasks of a run</li>
 *   <li>{@link kvloader.spi.RunOptions}: concurrency and timeout limits for a run</li>
 *   <li>{@link kvloader.spi.MetricsExporter}: metrics export</li>
 * </ul>
 */
package kvloader.spi;
