package io.campaign.util;

import io.campaign.model.ErrorRecord;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ErrorHistoryCodecTest {

  private final ErrorHistoryCodec codec = new ErrorHistoryCodec(JsonCodec.getDefault());

  @Test
  void preservesOrderAndFields() {
    List<ErrorRecord> history = List.of(
        new ErrorRecord(Instant.parse("2024-05-01T12:00:00Z"), 1, "ETIMEDOUT", "socket timeout"),
        new ErrorRecord(Instant.parse("2024-05-01T12:01:00.123Z"), 2, "RATE_LIMITED", null));

    List<ErrorRecord> decoded = codec.decode(codec.encode(history));

    assertEquals(history, decoded);
  }

  @Test
  void emptyHistory() {
    assertEquals("[]", codec.encode(List.of()));
    assertTrue(codec.decode(null).isEmpty());
  }
}
