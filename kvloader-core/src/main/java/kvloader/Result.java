package kvloader;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a key lookup: either a loaded value or a {@link LoadError}.
 *
 * <ul>
 *   <li>{@link Ok}: the key resolved; the value may be {@code null} if the loader
 *       mapped the key to {@code null}.</li>
 *   <li>{@link Err}: the key is unresolved or its batch failed; inspect
 *       {@link Err#error()} to tell the cases apart.</li>
 * </ul>
 *
 * <p>Instances are immutable.
 *
 * @param <T> value type
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

  /**
   * Creates a successful result.
   *
   * @param value the loaded value, may be {@code null}
   * @param <T>   value type
   * @return an {@link Ok} result
   */
  static <T> Result<T> ok(T value) {
    return new Ok<>(value);
  }

  /**
   * Creates a failed result.
   *
   * @param error the failure
   * @param <T>   value type
   * @return an {@link Err} result
   * @throws NullPointerException if {@code error} is null
   */
  static <T> Result<T> err(LoadError error) {
    return new Err<>(error);
  }

  boolean isOk();

  /**
   * Returns the value, or throws a {@link KeyLoadException} carrying the error.
   *
   * @return the loaded value
   * @throws KeyLoadException if this is an {@link Err}
   */
  T getOrThrow();

  /**
   * Transforms the value of an {@link Ok}; an {@link Err} passes through unchanged.
   *
   * @param mapper value transformation
   * @param <R>    new value type
   * @return the mapped result
   */
  <R> Result<R> map(Function<? super T, ? extends R> mapper);

  /** A resolved value. */
  record Ok<T>(T value) implements Result<T> {
    @Override
    public boolean isOk() {
      return true;
    }

    @Override
    public T getOrThrow() {
      return value;
    }

    @Override
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
      return new Ok<>(mapper.apply(value));
    }
  }

  /** An unresolved or failed lookup. */
  record Err<T>(LoadError error) implements Result<T> {
    public Err {
      Objects.requireNonNull(error, "error");
    }

    @Override
    public boolean isOk() {
      return false;
    }

    @Override
    public T getOrThrow() {
      throw new KeyLoadException(error);
    }

    @Override
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
      return new Err<>(error);
    }
  }
}
