package io.campaign.frequency;

import io.campaign.model.RecipientPreferences;
import io.campaign.model.SegmentFilter;
import io.campaign.spi.RecipientStore;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FrequencyGuardTest {

  @Test
  void recipientAtWeeklyCapIsExcluded() {
    RecipientPreferences preferences = new RecipientPreferences("r-1", false, 7, null);

    assertEquals(Eligibility.FREQUENCY_CAPPED, FrequencyGuard.evaluate(preferences, 7));
  }

  @Test
  void recipientBelowCapIsEligible() {
    RecipientPreferences preferences = new RecipientPreferences("r-1", false, 6, null);

    assertEquals(Eligibility.ELIGIBLE, FrequencyGuard.evaluate(preferences, 7));
  }

  @Test
  void ownCapOverridesDefault() {
    assertEquals(Eligibility.FREQUENCY_CAPPED,
        FrequencyGuard.evaluate(new RecipientPreferences("r-1", false, 2, 2), 7));
    assertEquals(Eligibility.ELIGIBLE,
        FrequencyGuard.evaluate(new RecipientPreferences("r-1", false, 9, 10), 7));
  }

  @Test
  void optOutWinsOverCap() {
    RecipientPreferences preferences = new RecipientPreferences("r-1", true, 0, null);

    Eligibility eligibility = FrequencyGuard.evaluate(preferences, 7);

    assertEquals(Eligibility.OPTED_OUT, eligibility);
    assertFalse(eligibility.isEligible());
    assertEquals("opted_out", eligibility.reason());
  }

  @Test
  void unknownRecipientIsEligible() {
    assertTrue(FrequencyGuard.evaluate(null, 7).isEligible());
  }

  @Test
  void rejectsNonPositiveDefaultCap() {
    assertThrows(IllegalArgumentException.class, () -> new FrequencyGuard(() -> null, new NoRecipients(), 0));
  }

  private static final class NoRecipients implements RecipientStore {
    @Override
    public List<String> findIds(Connection conn, SegmentFilter filter,
        String afterId, int limit) {
      return List.of();
    }

    @Override
    public Optional<RecipientPreferences> findPreferences(Connection conn, String recipientId) {
      return Optional.empty();
    }

    @Override
    public int incrementWeeklySends(Connection conn, String recipientId, Instant sentAt) {
      return 0;
    }

    @Override
    public int updateOptOut(Connection conn, String recipientId, boolean optedOut, String reason,
        Instant now) {
      return 0;
    }
  }
}
