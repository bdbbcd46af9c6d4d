package io.campaign.spring.boot;

import io.campaign.CampaignEngine;
import io.campaign.CampaignOperations;
import io.campaign.SendCollaborator;
import io.campaign.analytics.AbTestManager;
import io.campaign.analytics.EngagementTracker;
import io.campaign.dispatch.FailureClassifier;
import io.campaign.jdbc.DataSourceConnectionProvider;
import io.campaign.jdbc.JdbcCampaignStores;
import io.campaign.jdbc.TableNames;
import io.campaign.retry.GeometricBackoffPolicy;
import io.campaign.spi.CampaignStores;
import io.campaign.spi.ConnectionProvider;
import io.campaign.spi.MetricsExporter;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;
import java.time.ZoneId;

/**
 * Auto-configuration for the campaign engine.
 *
 * <p>Wires a {@link CampaignEngine} from a {@link DataSource}, an application-provided
 * {@link SendCollaborator} and {@link CampaignProperties}. The engine's operator facades are
 * exposed as beans of their own.
 *
 * @see CampaignProperties
 * @see CampaignMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(CampaignEngine.class)
@ConditionalOnBean({DataSource.class, SendCollaborator.class})
@ConditionalOnProperty(prefix = "campaign", name = "enabled", matchIfMissing = true)
@EnableConfigurationProperties(CampaignProperties.class)
public class CampaignAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean
  public CampaignStores campaignStores(DataSource dataSource, CampaignProperties props) {
    return JdbcCampaignStores.create(dataSource, TableNames.withPrefix(props.getTablePrefix()));
  }

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean(destroyMethod = "close")
  @ConditionalOnMissingBean
  public CampaignEngine campaignEngine(CampaignProperties props,
      ConnectionProvider connectionProvider,
      CampaignStores stores,
      SendCollaborator sendCollaborator,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<FailureClassifier> classifierProvider) {

    CampaignProperties.Retry retry = props.getRetry();
    CampaignProperties.Dispatcher dispatcher = props.getDispatcher();
    var builder = CampaignEngine.builder()
        .connectionProvider(connectionProvider)
        .stores(stores)
        .sendCollaborator(sendCollaborator)
        .backoffPolicy(new GeometricBackoffPolicy(retry.getTransientDelay(), retry.getRateLimitedDelay(),
            retry.getMultiplier(), retry.getMaxDelay()))
        .maxAttempts(retry.getMaxAttempts())
        .retryBatchSize(retry.getBatchSize())
        .retryIntervalMs(retry.getIntervalMs())
        .retryClaimLocking(retry.isClaimLocking())
        .dispatchBatchSize(dispatcher.getBatchSize())
        .dispatchIntervalMs(dispatcher.getIntervalMs())
        .segmentPageSize(dispatcher.getSegmentPageSize())
        .lockTimeout(dispatcher.getLockTimeout())
        .defaultWeeklyCap(props.getFrequency().getDefaultWeeklyCap())
        .significanceThreshold(props.getAbTest().getSignificanceThreshold())
        .zone(ZoneId.of(props.getTimeZone()));
    if (props.getOwnerId() != null && !props.getOwnerId().isBlank()) {
      builder.ownerId(props.getOwnerId());
    }
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    FailureClassifier classifier = classifierProvider.getIfAvailable();
    if (classifier != null) {
      builder.failureClassifier(classifier);
    }

    CampaignEngine engine = builder.build();
    if (props.isAutoStart()) {
      engine.start();
    }
    return engine;
  }

  @Bean
  @ConditionalOnMissingBean
  public CampaignOperations campaignOperations(CampaignEngine engine) {
    return engine.operations();
  }

  @Bean
  @ConditionalOnMissingBean
  public EngagementTracker engagementTracker(CampaignEngine engine) {
    return engine.engagement();
  }

  @Bean
  @ConditionalOnMissingBean
  public AbTestManager abTestManager(CampaignEngine engine) {
    return engine.abTests();
  }
}
