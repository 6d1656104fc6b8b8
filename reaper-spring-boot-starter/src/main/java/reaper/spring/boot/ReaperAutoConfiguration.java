package reaper.spring.boot;

import reaper.Reaper;
import reaper.ReaperConfig;
import reaper.jdbc.DataSourceConnectionProvider;
import reaper.jdbc.store.AbstractJdbcReplicaStore;
import reaper.jdbc.store.JdbcReplicaStores;
import reaper.spi.ConnectionProvider;
import reaper.spi.MetricsExporter;
import reaper.spi.PhysicalDeleter;
import reaper.spi.ReplicaStore;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the replica reaper.
 *
 * <p>Wires a {@link Reaper} from a {@link DataSource}, {@link ReaperProperties} and an
 * application-supplied {@link PhysicalDeleter}. Without a deleter bean only the store,
 * connection provider and configuration beans are created.
 *
 * @see ReaperProperties
 * @see ReaperMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(Reaper.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(ReaperProperties.class)
public class ReaperAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ReplicaStore.class)
  public AbstractJdbcReplicaStore replicaStore(DataSource dataSource, ReaperProperties props) {
    return JdbcReplicaStores.detect(dataSource, props.getTableName());
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean
  public ReaperConfig reaperConfig(ReaperProperties props) {
    return ReaperConfig.builder()
        .immediateCleanup(props.isEnableImmediateCleanup())
        .dbBatchSize(props.getDbBatchSize())
        .refreshTriggerRatio(props.getRefreshTriggerRatio())
        .delaySeconds(props.getDelaySeconds())
        .chunkSize(props.getChunkSize())
        .deletionChunkSize(props.getDeletionChunkSize())
        .build();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(PhysicalDeleter.class)
  public Reaper reaper(ReaperProperties props,
      ReaperConfig config,
      ConnectionProvider connectionProvider,
      ReplicaStore replicaStore,
      PhysicalDeleter deleter,
      ObjectProvider<MetricsExporter> metricsProvider) {

    Reaper.Builder builder = Reaper.builder()
        .connectionProvider(connectionProvider)
        .replicaStore(replicaStore)
        .deleter(deleter)
        .config(config)
        .rseIds(props.getRseIds())
        .intervalMs(props.getIntervalMs());
    if (props.getWorkerId() != null && !props.getWorkerId().isEmpty()) {
      builder.workerId(props.getWorkerId());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }

    Reaper reaper = builder.build();
    if (props.isAutoStart()) {
      reaper.start();
    }
    return reaper;
  }
}
