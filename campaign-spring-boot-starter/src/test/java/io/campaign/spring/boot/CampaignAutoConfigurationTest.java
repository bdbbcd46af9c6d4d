package io.campaign.spring.boot;

import io.campaign.CampaignDefinition;
import io.campaign.CampaignEngine;
import io.campaign.CampaignOperations;
import io.campaign.SendCollaborator;
import io.campaign.SendError;
import io.campaign.SendOutcome;
import io.campaign.analytics.AbTestManager;
import io.campaign.analytics.EngagementTracker;
import io.campaign.dispatch.FailureClassifier;
import io.campaign.jdbc.DataSourceConnectionProvider;
import io.campaign.model.CampaignStatus;
import io.campaign.model.DeliveryStatus;
import io.campaign.model.ErrorClass;
import io.campaign.model.ScheduleStatus;
import io.campaign.spi.CampaignStores;
import io.campaign.spi.ConnectionProvider;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CampaignAutoConfigurationTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          CampaignAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:campaign_auto_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.schema-locations=classpath:schema.sql",
          "campaign.auto-start=false");

  @Test
  void createsAllBeans() {
    runner.withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
      assertTrue(ctx.containsBean("campaignStores"));
      assertTrue(ctx.containsBean("connectionProvider"));
      assertTrue(ctx.containsBean("campaignEngine"));
      assertTrue(ctx.containsBean("campaignOperations"));
      assertTrue(ctx.containsBean("engagementTracker"));
      assertTrue(ctx.containsBean("abTestManager"));

      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertNotNull(ctx.getBean(CampaignStores.class));
      var engine = ctx.getBean(CampaignEngine.class);
      assertSame(engine.operations(), ctx.getBean(CampaignOperations.class));
      assertSame(engine.engagement(), ctx.getBean(EngagementTracker.class));
      assertSame(engine.abTests(), ctx.getBean(AbTestManager.class));
    });
  }

  @Test
  void operationsWorkAgainstInitializedSchema() {
    runner.withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
      var operations = ctx.getBean(CampaignOperations.class);
      var campaign = operations.createCampaign(CampaignDefinition.builder()
          .title("Spring launch")
          .content("Hello from the starter")
          .build());

      assertEquals(CampaignStatus.ACTIVE, campaign.status());
      var schedule = operations.schedule(campaign.campaignId()).orElseThrow();
      assertEquals(ScheduleStatus.SCHEDULED, schedule.status());
      assertEquals(0, schedule.executionCount());
    });
  }

  @Test
  void usesConfiguredOwnerId() {
    runner
        .withPropertyValues("campaign.owner-id=node-7")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          var engine = ctx.getBean(CampaignEngine.class);
          assertEquals("node-7", engine.dispatcher().ownerId());
        });
  }

  @Test
  void customFailureClassifierIsPickedUp() {
    runner.withUserConfiguration(CollaboratorConfig.class, ClassifierConfig.class).run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertSame(ClassifierConfig.CLASSIFIER, ctx.getBean(FailureClassifier.class));
    });
  }

  @Test
  void invalidTablePrefixFailsStartup() {
    runner
        .withPropertyValues("campaign.table-prefix=bad-prefix")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          assertNotNull(ctx.getStartupFailure());
          assertInstanceOf(IllegalArgumentException.class, findRootCause(ctx.getStartupFailure()));
        });
  }

  @Test
  void notLoadedWithoutSendCollaborator() {
    runner.run(ctx -> {
      assertNull(ctx.getStartupFailure());
      assertFalse(ctx.containsBean("campaignEngine"));
    });
  }

  @Test
  void notLoadedWithoutDataSource() {
    new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(CampaignAutoConfiguration.class))
        .withUserConfiguration(CollaboratorConfig.class)
        .run(ctx -> {
          assertFalse(ctx.containsBean("campaignEngine"));
        });
  }

  @Test
  void disabledByProperty() {
    runner
        .withPropertyValues("campaign.enabled=false")
        .withUserConfiguration(CollaboratorConfig.class).run(ctx -> {
          assertFalse(ctx.containsBean("campaignEngine"));
          assertFalse(ctx.containsBean("campaignStores"));
        });
  }

  @Test
  void respectsConditionalOnMissingBean() {
    runner.withUserConfiguration(CollaboratorConfig.class, CustomProviderConfig.class).run(ctx -> {
      assertEquals("myConnectionProvider", ctx.getBeanNamesForType(ConnectionProvider.class)[0]);
      assertFalse(ctx.containsBean("connectionProvider"));
    });
  }

  @Configuration
  static class CollaboratorConfig {
    @Bean
    SendCollaborator sendCollaborator() {
      return (recipientId, content) -> SendOutcome.success();
    }
  }

  @Configuration
  static class ClassifierConfig {
    static final FailureClassifier CLASSIFIER = new FailureClassifier() {
      @Override
      public ErrorClass classify(SendError error) {
        return ErrorClass.TRANSIENT;
      }

      @Override
      public DeliveryStatus terminalStatus(SendError error) {
        return DeliveryStatus.FAILED;
      }
    };

    @Bean
    FailureClassifier failureClassifier() {
      return CLASSIFIER;
    }
  }

  @Configuration
  static class CustomProviderConfig {
    @Bean("myConnectionProvider")
    ConnectionProvider connectionProvider(javax.sql.DataSource dataSource) {
      return new DataSourceConnectionProvider(dataSource);
    }
  }

  private static Throwable findRootCause(Throwable t) {
    while (t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    return t;
  }
}
