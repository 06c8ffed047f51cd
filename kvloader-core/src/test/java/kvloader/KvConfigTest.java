package kvloader;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class KvConfigTest {

  @Test
  void defaults() {
    KvConfig config = KvConfig.defaults();

    assertEquals(Runtime.getRuntime().availableProcessors() * 2, config.getMaxConcurrency());
    assertEquals(30_000L, config.getTimeoutMs());
  }

  @Test
  void settersAreFluent() {
    KvConfig config = new KvConfig().setMaxConcurrency(5).setTimeoutMs(250);

    assertEquals(5, config.getMaxConcurrency());
    assertEquals(250, config.getTimeoutMs());
  }

  @Test
  void zeroTimeoutIsValid() {
    assertDoesNotThrow(() -> new KvConfig().setTimeoutMs(0).validate());
  }

  @Test
  void validateRejectsNonPositiveConcurrency() {
    assertThrows(IllegalArgumentException.class, () -> new KvConfig().setMaxConcurrency(0).validate());
  }

  @Test
  void validateRejectsNegativeTimeout() {
    assertThrows(IllegalArgumentException.class, () -> new KvConfig().setTimeoutMs(-5).validate());
  }
}
