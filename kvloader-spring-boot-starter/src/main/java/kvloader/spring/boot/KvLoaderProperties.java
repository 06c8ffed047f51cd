package kvloader.spring.boot;

import kvloader.KvConfig;
import kvloader.exec.ExecutorTaskRunner;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for kvloader sources.
 *
 * @see KvLoaderAutoConfiguration
 */
@ConfigurationProperties(prefix = "kvloader")
public class KvLoaderProperties {

  /**
   * Maximum number of batches loaded in parallel per run. Unset means twice the number of
   * available processors.
   */
  private Integer maxConcurrency;

  /**
   * Wall-clock bound of a run in milliseconds.
   */
  private long timeoutMs = KvConfig.DEFAULT_TIMEOUT_MS;

  private final Runner runner = new Runner();
  private final Metrics metrics = new Metrics();

  public Integer getMaxConcurrency() {
    return maxConcurrency;
  }

  public void setMaxConcurrency(Integer maxConcurrency) {
    this.maxConcurrency = maxConcurrency;
  }

  public long getTimeoutMs() {
    return timeoutMs;
  }

  public void setTimeoutMs(long timeoutMs) {
    this.timeoutMs = timeoutMs;
  }

  public Runner getRunner() {
    return runner;
  }

  public Metrics getMetrics() {
    return metrics;
  }

  /**
   * Builds a validated {@link KvConfig} from these properties.
   *
   * @return the config
   * @throws IllegalArgumentException if a value is out of range
   */
  public KvConfig toConfig() {
    KvConfig config = KvConfig.defaults().setTimeoutMs(timeoutMs);
    if (maxConcurrency != null) {
      config.setMaxConcurrency(maxConcurrency);
    }
    return config.validate();
  }

  public enum RunnerType {
    /** Thread pool per run, bounded by {@code max-concurrency}. */
    EXECUTOR,
    /** Sequential execution on the calling thread. */
    DIRECT
  }

  public static class Runner {
    private RunnerType type = RunnerType.EXECUTOR;
    private String threadPrefix = ExecutorTaskRunner.DEFAULT_THREAD_PREFIX;

    public RunnerType getType() {
      return type;
    }

    public void setType(RunnerType type) {
      this.type = type;
    }

    public String getThreadPrefix() {
      return threadPrefix;
    }

    public void setThreadPrefix(String threadPrefix) {
      this.threadPrefix = threadPrefix;
    }
  }

  public static class Metrics {
    private boolean enabled = true;
    private String namePrefix = "kvloader";

    public boolean isEnabled() {
      return enabled;
    }

    public void setEnabled(boolean enabled) {
      this.enabled = enabled;
    }

    public String getNamePrefix() {
      return namePrefix;
    }

    public void setNamePrefix(String namePrefix) {
      this.namePrefix = namePrefix;
    }
  }
}
