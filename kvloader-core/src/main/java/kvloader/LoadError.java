package kvloader;

import java.util.Objects;

/**
 * Reason a lookup did not produce a value.
 *
 * <p>The three kinds stay distinguishable so callers can branch on them:
 * <ul>
 *   <li>{@link NotFound}: the batch has results, but not for this key.</li>
 *   <li>{@link UnknownBatch}: nothing has ever been cached for the batch.</li>
 *   <li>{@link Failed}: the loader (or the task runner executing it) failed for the
 *       whole batch; every key requested in that batch carries the same instance.</li>
 * </ul>
 */
public sealed interface LoadError permits LoadError.NotFound, LoadError.UnknownBatch, LoadError.Failed {

  /** Singleton for keys absent from a known batch. */
  NotFound NOT_FOUND = new NotFound();

  static NotFound notFound() {
    return NOT_FOUND;
  }

  static UnknownBatch unknownBatch(Object batch) {
    return new UnknownBatch(batch);
  }

  static Failed failed(String reason) {
    return new Failed(reason, null);
  }

  static Failed failed(String reason, Throwable cause) {
    return new Failed(reason, cause);
  }

  /**
   * Human-readable description of the error.
   *
   * @return the message
   */
  String message();

  /** Key was never requested, or the loader did not return it. */
  record NotFound() implements LoadError {
    @Override
    public String message() {
      return "not_found";
    }
  }

  /**
   * No results exist for the batch identifier.
   *
   * @param batch the batch identifier that was looked up
   */
  record UnknownBatch(Object batch) implements LoadError {
    @Override
    public String message() {
      return "Unable to find batch " + batch;
    }
  }

  /**
   * Batch-level failure broadcast to every requested key. Equality and hash code use
   * {@code reason} only; the cause is diagnostic.
   *
   * @param reason opaque failure reason, compared by value
   * @param cause  underlying exception, or {@code null}
   */
  record Failed(String reason, Throwable cause) implements LoadError {
    public Failed {
      Objects.requireNonNull(reason, "reason");
    }

    @Override
    public String message() {
      return reason;
    }

    @Override
    public boolean equals(Object o) {
      return o instanceof Failed other && reason.equals(other.reason);
    }

    @Override
    public int hashCode() {
      return reason.hashCode();
    }
  }
}
