package kvloader.spi;

/**
 * Execution limits handed to a {@link TaskRunner} for one run.
 *
 * @param maxConcurrency maximum number of batch tasks executing at once (&ge; 1)
 * @param timeoutMs      wall-clock bound for the whole run in milliseconds (&ge; 0)
 */
public record RunOptions(int maxConcurrency, long timeoutMs) {
  public RunOptions {
    if (maxConcurrency < 1) {
      throw new IllegalArgumentException("maxConcurrency must be >= 1");
    }
    if (timeoutMs < 0) {
      throw new IllegalArgumentException("timeoutMs must be >= 0");
    }
  }
}
