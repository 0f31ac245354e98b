package eventlog.spring.boot;

import eventlog.EventLog;
import eventlog.EventQueryService;
import eventlog.jdbc.DataSourceConnectionProvider;
import eventlog.jdbc.TableNames;
import eventlog.jdbc.position.JdbcProjectionPositionStore;
import eventlog.jdbc.store.AbstractJdbcEventLogStore;
import eventlog.jdbc.store.JdbcEventLogStores;
import eventlog.projection.ProjectionConfig;
import eventlog.projection.ProjectionManager;
import eventlog.projection.ProjectionOrchestrator;
import eventlog.projection.ProjectionRunner;
import eventlog.projection.Projector;
import eventlog.spi.ConnectionProvider;
import eventlog.spi.MetricsExporter;
import eventlog.spi.ProjectionPositionStore;
import eventlog.spi.TxContext;
import eventlog.spring.SpringTxContext;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.sql.init.dependency.DependsOnDatabaseInitialization;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the event log and its projections.
 *
 * <p>Wires an {@link EventLog} and an {@link EventQueryService} from a {@link DataSource}
 * and {@link EventLogProperties}. Every {@link Projector} bean gets its own
 * {@link ProjectionRunner}, registered with a {@link ProjectionManager} that starts them
 * unless {@code eventlog.projection.auto-start} is false.
 *
 * @see EventLogProperties
 * @see EventLogMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(EventLog.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(EventLogProperties.class)
public class EventLogAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public AbstractJdbcEventLogStore eventLogStore(DataSource dataSource, EventLogProperties props) {
    String dialect = props.getDialect();
    AbstractJdbcEventLogStore store = dialect == null || dialect.isBlank()
        ? JdbcEventLogStores.detect(dataSource)
        : JdbcEventLogStores.get(dialect);
    if (!TableNames.STREAM_TABLE.equals(props.getStreamTable())
        || !TableNames.EVENT_TABLE.equals(props.getEventTable())) {
      return store.withTables(props.getStreamTable(), props.getEventTable());
    }
    return store;
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(TxContext.class)
  public SpringTxContext txContext(DataSource dataSource) {
    return new SpringTxContext(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(ProjectionPositionStore.class)
  public JdbcProjectionPositionStore projectionPositionStore(EventLogProperties props) {
    return new JdbcProjectionPositionStore(props.getPositionTable());
  }

  @Bean
  @ConditionalOnMissingBean
  public EventLog eventLog(ConnectionProvider connectionProvider, TxContext txContext,
      AbstractJdbcEventLogStore eventLogStore, ObjectProvider<MetricsExporter> metricsProvider) {
    return EventLog.builder()
        .connectionProvider(connectionProvider)
        .txContext(txContext)
        .store(eventLogStore)
        .metrics(metricsProvider.getIfAvailable())
        .build();
  }

  @Bean
  @ConditionalOnMissingBean
  public EventQueryService eventQueryService(ConnectionProvider connectionProvider,
      AbstractJdbcEventLogStore eventLogStore) {
    return new EventQueryService(connectionProvider, eventLogStore);
  }

  @Bean
  @ConditionalOnMissingBean
  public ProjectionConfig projectionConfig(EventLogProperties props) {
    return props.getProjection().toConfig();
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  @DependsOnDatabaseInitialization
  public ProjectionManager projectionManager(EventLogProperties props,
      ConnectionProvider connectionProvider,
      AbstractJdbcEventLogStore eventLogStore,
      ProjectionPositionStore positionStore,
      ProjectionConfig projectionConfig,
      ObjectProvider<Projector> projectors,
      ObjectProvider<MetricsExporter> metricsProvider) {

    MetricsExporter metrics = metricsProvider.getIfAvailable();
    ProjectionManager manager = new ProjectionManager();
    projectors.orderedStream().forEach(projector -> manager.register(ProjectionRunner.builder()
        .orchestrator(ProjectionOrchestrator.builder()
            .connectionProvider(connectionProvider)
            .eventLogStore(eventLogStore)
            .positionStore(positionStore)
            .projector(projector)
            .config(projectionConfig)
            .metrics(metrics)
            .build())
        .build()));

    if (props.getProjection().isAutoStart()) {
      try {
        manager.startAll();
      } catch (RuntimeException e) {
        manager.close();
        throw e;
      }
    }
    return manager;
  }
}
