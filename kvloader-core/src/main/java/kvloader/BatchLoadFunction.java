package kvloader;

import java.util.Map;
import java.util.Set;

/**
 * User-supplied bulk loader for one batch identifier.
 *
 * <p>Implementations receive every key collected for {@code batch} since the last run and
 * return the values they could resolve. Keys missing from the returned map stay unresolved
 * and read back as {@link LoadError.NotFound}. Throwing fails the whole batch: every
 * requested key is cached as {@link LoadError.Failed} with the exception message as reason.
 *
 * <p>Invoked concurrently for distinct batch identifiers; must not mutate state the
 * calling source depends on.
 *
 * @param <B> batch identifier type
 * @param <K> key type
 * @param <V> value type
 */
@FunctionalInterface
public interface BatchLoadFunction<B, K, V> {

  /**
   * Loads values for a set of keys.
   *
   * @param batch the batch identifier the keys were requested under
   * @param keys  unmodifiable, non-empty set of requested keys
   * @return values keyed by key; never {@code null}
   * @throws Exception to fail the whole batch
   */
  Map<K, V> load(B batch, Set<K> keys) throws Exception;
}
