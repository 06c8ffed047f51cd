package kvloader.cache;

import kvloader.LoadError;
import kvloader.Result;
import kvloader.dispatch.BatchOutcome;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ResultCacheTest {

  private final ResultCache<String, Integer, String> cache = new ResultCache<>();

  @Test
  void getDistinguishesUnknownBatchFromMissingKey() {
    cache.put("users", 1, Result.ok("a"));

    assertEquals(Result.err(LoadError.unknownBatch("posts")), cache.get("posts", 1));
    assertEquals(Result.err(LoadError.notFound()), cache.get("users", 2));
    assertEquals(Result.ok("a"), cache.get("users", 1));
  }

  @Test
  void mergeOfValuesIsAdditivePerKey() {
    cache.put("users", 1, Result.ok("old"));
    cache.put("users", 2, Result.ok("kept"));

    cache.merge(new BatchOutcome<>("users", Set.of(1, 3), Result.ok(Map.of(1, "new", 3, "c"))));

    assertEquals(Result.ok("new"), cache.get("users", 1));
    assertEquals(Result.ok("kept"), cache.get("users", 2));
    assertEquals(Result.ok("c"), cache.get("users", 3));
  }

  @Test
  void mergeOfValuesLeavesOmittedKeysUncached() {
    cache.merge(new BatchOutcome<>("users", Set.of(1, 2), Result.ok(Map.of(1, "a"))));

    assertTrue(cache.contains("users", 1));
    assertFalse(cache.contains("users", 2));
    assertTrue(cache.containsBatch("users"));
  }

  @Test
  void mergeOfEmptyValuesStillRegistersBatch() {
    cache.merge(new BatchOutcome<>("users", Set.of(1), Result.ok(Map.of())));

    assertTrue(cache.containsBatch("users"));
    assertEquals(Result.err(LoadError.notFound()), cache.get("users", 1));
  }

  @Test
  void mergeOfErrorIsWrittenToEveryRequestedKey() {
    LoadError error = LoadError.failed("db down");
    cache.put("users", 9, Result.ok("untouched"));

    cache.merge(new BatchOutcome<>("users", Set.of(1, 2, 3), Result.err(error)));

    for (int key : List.of(1, 2, 3)) {
      var err = (Result.Err<String>) cache.get("users", key);
      assertSame(error, err.error());
    }
    assertEquals(Result.ok("untouched"), cache.get("users", 9));
  }

  @Test
  void mergeOfErrorOverwritesEarlierValue() {
    cache.put("users", 1, Result.ok("a"));

    cache.merge(new BatchOutcome<>("users", Set.of(1), Result.err(LoadError.failed("gone"))));

    assertFalse(cache.get("users", 1).isOk());
  }

  @Test
  void missingReturnsUncachedKeysInOrder() {
    cache.put("users", 2, Result.ok("b"));
    cache.put("users", 4, Result.err(LoadError.failed("x")));

    assertEquals(Set.of(1, 3), cache.missing("users", List.of(1, 2, 3, 4)));
    assertEquals(List.of(3, 1), List.copyOf(cache.missing("users", List.of(3, 2, 1))));
    assertEquals(Set.of(7), cache.missing("unknown", List.of(7)));
  }

  @Test
  void batchCountTracksDistinctBatches() {
    cache.put("users", 1, Result.ok("a"));
    cache.put("users", 2, Result.ok("b"));
    cache.put("posts", 1, Result.ok("p"));

    assertEquals(2, cache.batchCount());
  }
}
