package io.campaign.spring.boot;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class CampaignPropertiesTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(PropsConfig.class);

  @Test
  void defaultValues() {
    runner.run(ctx -> {
      var props = ctx.getBean(CampaignProperties.class);
      assertTrue(props.isEnabled());
      assertTrue(props.isAutoStart());
      assertEquals("", props.getOwnerId());
      assertEquals("UTC", props.getTimeZone());
      assertEquals("", props.getTablePrefix());
      assertEquals(60_000, props.getDispatcher().getIntervalMs());
      assertEquals(5, props.getDispatcher().getBatchSize());
      assertEquals(500, props.getDispatcher().getSegmentPageSize());
      assertEquals(Duration.ofMinutes(10), props.getDispatcher().getLockTimeout());
      assertEquals(30_000, props.getRetry().getIntervalMs());
      assertEquals(100, props.getRetry().getBatchSize());
      assertEquals(5, props.getRetry().getMaxAttempts());
      assertEquals(Duration.ofSeconds(60), props.getRetry().getTransientDelay());
      assertEquals(Duration.ofMinutes(15), props.getRetry().getRateLimitedDelay());
      assertEquals(2.0, props.getRetry().getMultiplier());
      assertEquals(Duration.ofHours(24), props.getRetry().getMaxDelay());
      assertFalse(props.getRetry().isClaimLocking());
      assertEquals(7, props.getFrequency().getDefaultWeeklyCap());
      assertEquals(0.05, props.getAbTest().getSignificanceThreshold());
      assertTrue(props.getMetrics().isEnabled());
      assertEquals("campaign", props.getMetrics().getNamePrefix());
    });
  }

  @Test
  void customValues() {
    runner.withPropertyValues(
        "campaign.enabled=false",
        "campaign.auto-start=false",
        "campaign.owner-id=node-1",
        "campaign.time-zone=Europe/Berlin",
        "campaign.table-prefix=mkt_",
        "campaign.dispatcher.interval-ms=1000",
        "campaign.dispatcher.batch-size=20",
        "campaign.dispatcher.segment-page-size=50",
        "campaign.dispatcher.lock-timeout=PT2M",
        "campaign.retry.interval-ms=5000",
        "campaign.retry.batch-size=10",
        "campaign.retry.max-attempts=3",
        "campaign.retry.transient-delay=PT30S",
        "campaign.retry.rate-limited-delay=PT5M",
        "campaign.retry.multiplier=3.0",
        "campaign.retry.max-delay=PT6H",
        "campaign.retry.claim-locking=true",
        "campaign.frequency.default-weekly-cap=3",
        "campaign.ab-test.significance-threshold=0.1",
        "campaign.metrics.enabled=false",
        "campaign.metrics.name-prefix=mkt.campaign"
    ).run(ctx -> {
      var props = ctx.getBean(CampaignProperties.class);
      assertFalse(props.isEnabled());
      assertFalse(props.isAutoStart());
      assertEquals("node-1", props.getOwnerId());
      assertEquals("Europe/Berlin", props.getTimeZone());
      assertEquals("mkt_", props.getTablePrefix());
      assertEquals(1000, props.getDispatcher().getIntervalMs());
      assertEquals(20, props.getDispatcher().getBatchSize());
      assertEquals(50, props.getDispatcher().getSegmentPageSize());
      assertEquals(Duration.ofMinutes(2), props.getDispatcher().getLockTimeout());
      assertEquals(5000, props.getRetry().getIntervalMs());
      assertEquals(10, props.getRetry().getBatchSize());
      assertEquals(3, props.getRetry().getMaxAttempts());
      assertEquals(Duration.ofSeconds(30), props.getRetry().getTransientDelay());
      assertEquals(Duration.ofMinutes(5), props.getRetry().getRateLimitedDelay());
      assertEquals(3.0, props.getRetry().getMultiplier());
      assertEquals(Duration.ofHours(6), props.getRetry().getMaxDelay());
      assertTrue(props.getRetry().isClaimLocking());
      assertEquals(3, props.getFrequency().getDefaultWeeklyCap());
      assertEquals(0.1, props.getAbTest().getSignificanceThreshold());
      assertFalse(props.getMetrics().isEnabled());
      assertEquals("mkt.campaign", props.getMetrics().getNamePrefix());
    });
  }

  @Configuration
  @EnableConfigurationProperties(CampaignProperties.class)
  static class PropsConfig {
  }
}
