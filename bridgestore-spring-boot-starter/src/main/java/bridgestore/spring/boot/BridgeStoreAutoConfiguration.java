package bridgestore.spring.boot;

import bridgestore.DatabaseAdapter;
import bridgestore.InitializationResult;
import bridgestore.config.AdapterSettings;
import bridgestore.config.DotEnvEnvironment;
import bridgestore.config.Environment;
import bridgestore.jdbc.JdbcDatabaseAdapters;
import bridgestore.spi.MetricsExporter;
import bridgestore.spi.StorageHandle;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Auto-configuration for the database adapter.
 *
 * <p>Runs {@link DatabaseAdapter#initialize()} while the context starts, so a
 * configuration or connectivity failure aborts startup. The resulting pool is
 * exposed as the application's {@link DataSource} unless one is already defined.
 *
 * @see BridgeStoreProperties
 * @see BridgeStoreMicrometerAutoConfiguration
 */
@AutoConfiguration(beforeName = "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration")
@ConditionalOnClass(DatabaseAdapter.class)
@EnableConfigurationProperties(BridgeStoreProperties.class)
public class BridgeStoreAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(Environment.class)
  public Environment bridgestoreEnvironment(org.springframework.core.env.Environment springEnvironment,
      BridgeStoreProperties props) {
    Environment environment = name -> Optional.ofNullable(springEnvironment.getProperty(name));
    if (!props.getDotenv().isEnabled()) {
      return environment;
    }
    return DotEnvEnvironment.load(Path.of(props.getDotenv().getPath()), environment);
  }

  @Bean
  @ConditionalOnMissingBean
  public AdapterSettings bridgestoreSettings(BridgeStoreProperties props) {
    return props.toSettings();
  }

  @Bean
  @ConditionalOnMissingBean
  public DatabaseAdapter databaseAdapter(BridgeStoreProperties props,
      AdapterSettings settings,
      Environment environment,
      ObjectProvider<MetricsExporter> metricsProvider) {
    return JdbcDatabaseAdapters.builder(settings)
        .environment(environment)
        .storeFactory(props.toStoreFactory())
        .metrics(metricsProvider.getIfAvailable(() -> MetricsExporter.NOOP))
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public InitializationResult bridgestoreInitialization(DatabaseAdapter adapter) {
    return adapter.initialize();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public StorageHandle storageHandle(InitializationResult initialization) {
    return initialization.handle();
  }

  @Bean(destroyMethod = "")
  @ConditionalOnMissingBean(DataSource.class)
  public DataSource bridgestoreDataSource(StorageHandle storageHandle) {
    return storageHandle.dataSource();
  }
}
