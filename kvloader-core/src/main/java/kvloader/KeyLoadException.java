package kvloader;

import java.util.Objects;

/**
 * Thrown by {@link Result#getOrThrow()} when a lookup did not resolve.
 *
 * <p>The engine itself never throws this; errors stay values until a caller opts in.
 */
public class KeyLoadException extends RuntimeException {
  private final LoadError error;

  public KeyLoadException(LoadError error) {
    super(Objects.requireNonNull(error, "error").message(), causeOf(error));
    this.error = error;
  }

  private static Throwable causeOf(LoadError error) {
    return error instanceof LoadError.Failed failed ? failed.cause() : null;
  }

  public LoadError getError() {
    return error;
  }
}
