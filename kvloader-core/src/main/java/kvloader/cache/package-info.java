/**
 * In-memory bookkeeping for a source: keys awaiting a fetch
 * ({@link kvloader.cache.PendingBatches}) and resolved results
 * ({@link kvloader.cache.ResultCache}).
 */
package kvloader.cache;
