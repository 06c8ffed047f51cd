package kvloader.spring.boot;

import kvloader.KvSource;
import kvloader.KvSourceFactory;
import kvloader.exec.DirectTaskRunner;
import kvloader.exec.ExecutorTaskRunner;
import kvloader.spi.MetricsExporter;
import kvloader.spi.TaskRunner;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for kvloader.
 *
 * <p>Exposes a shared {@link TaskRunner} and a {@link KvSourceFactory} configured from
 * {@link KvLoaderProperties}. Applications create one source per unit of work from the
 * factory. A {@link MetricsExporter} bean, when present, is passed to every source.
 *
 * @see KvLoaderProperties
 * @see KvLoaderMicrometerAutoConfiguration
 */
@AutoConfiguration
@ConditionalOnClass(KvSource.class)
@EnableConfigurationProperties(KvLoaderProperties.class)
public class KvLoaderAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(TaskRunner.class)
  public TaskRunner kvLoaderTaskRunner(KvLoaderProperties props) {
    return switch (props.getRunner().getType()) {
      case EXECUTOR -> new ExecutorTaskRunner(props.getRunner().getThreadPrefix());
      case DIRECT -> DirectTaskRunner.INSTANCE;
    };
  }

  @Bean
  @ConditionalOnMissingBean
  public KvSourceFactory kvSourceFactory(KvLoaderProperties props, TaskRunner taskRunner,
      ObjectProvider<MetricsExporter> metricsProvider) {
    MetricsExporter metrics = metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP);
    return new KvSourceFactory(taskRunner, metrics, props.toConfig());
  }
}
