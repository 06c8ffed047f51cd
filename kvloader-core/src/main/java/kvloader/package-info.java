/**
 * Batching, deduplicating key lookup.
 *
 * <p>{@link kvloader.KvSource} collects point and bulk lookups, loads them one call per
 * batch identifier when {@link kvloader.KvSource#run()} is invoked, and serves reads from
 * its cache. Errors are values: see {@link kvloader.Result} and {@link kvloader.LoadError}.
 *
 * @see kvloader.KvSource
 * @see kvloader.KvSourceFactory
 * @see kvloader.spi.TaskRunner
 */
package kvloader;
