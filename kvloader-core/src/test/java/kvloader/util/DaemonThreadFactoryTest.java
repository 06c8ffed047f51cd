package kvloader.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DaemonThreadFactoryTest {

  @Test
  void loaderThreadsAreDaemonsWithPrefix() {
    DaemonThreadFactory factory = new DaemonThreadFactory("kvloader-loader-");

    Thread thread = factory.newThread(() -> {
    });

    assertTrue(thread.isDaemon());
    assertEquals("kvloader-loader-1", thread.getName());
  }

  @Test
  void namesAreSequentialPerFactory() {
    DaemonThreadFactory first = new DaemonThreadFactory("run-");
    DaemonThreadFactory second = new DaemonThreadFactory("run-");

    first.newThread(() -> {
    });
    Thread t2 = first.newThread(() -> {
    });
    Thread other = second.newThread(() -> {
    });

    assertEquals("run-2", t2.getName());
    assertEquals("run-1", other.getName());
  }

  @Test
  void nullPrefixThrows() {
    assertThrows(NullPointerException.class, () -> new DaemonThreadFactory(null));
  }
}
