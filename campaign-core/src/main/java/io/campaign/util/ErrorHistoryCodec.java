package io.campaign.util;

import io.campaign.model.ErrorRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts retry error history to and from its single-column JSON array form.
 */
public final class ErrorHistoryCodec {
  private final JsonCodec jsonCodec;

  public ErrorHistoryCodec(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public String encode(List<ErrorRecord> history) {
    List<Map<String, String>> items = new ArrayList<>(history.size());
    for (ErrorRecord record : history) {
      Map<String, String> item = new LinkedHashMap<>();
      item.put("timestamp", record.timestamp().toString());
      item.put("attempt", Integer.toString(record.attempt()));
      item.put("code", record.code());
      item.put("message", record.message());
      items.add(item);
    }
    return jsonCodec.toJsonArray(items);
  }

  public List<ErrorRecord> decode(String json) {
    List<ErrorRecord> history = new ArrayList<>();
    for (Map<String, String> item : jsonCodec.parseArray(json)) {
      history.add(new ErrorRecord(
          Instant.parse(item.get("timestamp")),
          Integer.parseInt(item.getOrDefault("attempt", "0")),
          item.get("code"),
          item.get("message")));
    }
    return history;
  }
}
