package kvloader;

/**
 * Settings for a {@link KvSource}.
 *
 * <p>{@code maxConcurrency} defaults to twice the number of processors available when this
 * object is created; {@code timeoutMs} defaults to 30 seconds. A source copies the values
 * when it is built.
 */
public final class KvConfig {
  public static final long DEFAULT_TIMEOUT_MS = 30_000L;

  private int maxConcurrency = defaultMaxConcurrency();
  private long timeoutMs = DEFAULT_TIMEOUT_MS;

  public static KvConfig defaults() {
    return new KvConfig();
  }

  public static int defaultMaxConcurrency() {
    return Runtime.getRuntime().availableProcessors() * 2;
  }

  public int getMaxConcurrency() {
    return maxConcurrency;
  }

  public KvConfig setMaxConcurrency(int maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
    return this;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public KvConfig setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
    return this;
  }

  /**
   * Checks the settings.
   *
   * @return this config
   * @throws IllegalArgumentException if {@code maxConcurrency < 1} or {@code timeoutMs < 0}
   */
  public KvConfig validate() {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    if (timeoutMs < 0) {
      throw new IllegalArgumentException("timeoutMs must be >= 0");
    }
    return this;
  }

  KvConfig copy() {
    return new KvConfig().setMaxConcurrency(maxConcurrency).setTimeoutMs(timeoutMs);
  }
}
