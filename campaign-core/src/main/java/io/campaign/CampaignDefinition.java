package io.campaign;

import io.campaign.model.RecurrenceRule;

import java.time.Instant;
import java.util.Objects;

/**
 * Operator input for creating a campaign. Create instances via {@link #builder()}.
 */
public final class CampaignDefinition {
  private final String title;
  private final String content;
  private final String segmentId;
  private final RecurrenceRule recurrence;
  private final Instant startAt;
  private final int executionOrder;

  private CampaignDefinition(Builder builder) {
    this.title = Objects.requireNonNull(builder.title, "title");
    this.content = Objects.requireNonNull(builder.content, "content");
    if (title.isBlank()) {
      throw new IllegalArgumentException("title must not be blank");
    }
    if (content.isEmpty()) {
      throw new IllegalArgumentException("content must not be empty");
    }
    this.segmentId = builder.segmentId;
    this.recurrence = builder.recurrence != null ? builder.recurrence : RecurrenceRule.once();
    this.startAt = builder.startAt;
    this.executionOrder = builder.executionOrder;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String title() {
    return title;
  }

  public String content() {
    return content;
  }

  /** Target segment, or {@code null} for every recipient. */
  public String segmentId() {
    return segmentId;
  }

  public RecurrenceRule recurrence() {
    return recurrence;
  }

  /** First execution time, or {@code null} to run at the next tick. */
  public Instant startAt() {
    return startAt;
  }

  public int executionOrder() {
    return executionOrder;
  }

  /**
   * Builder for {@link CampaignDefinition}.
   */
  public static final class Builder {
    private String title;
    private String content;
    private String segmentId;
    private RecurrenceRule recurrence;
    private Instant startAt;
    private int executionOrder;

    private Builder() {
    }

    /**
     * <p><b>Required.</b>
     */
    public Builder title(String title) {
      this.title = title;
      return this;
    }

    /**
     * Sets the payload handed to the send collaborator.
     *
     * <p><b>Required.</b>
     */
    public Builder content(String content) {
      this.content = content;
      return this;
    }

    /**
     * <p>Optional. Defaults to no segment, which addresses every recipient.
     */
    public Builder segmentId(String segmentId) {
      this.segmentId = segmentId;
      return this;
    }

    /**
     * <p>Optional. Defaults to {@link RecurrenceRule#once()}.
     */
    public Builder recurrence(RecurrenceRule recurrence) {
      this.recurrence = recurrence;
      return this;
    }

    /**
     * <p>Optional. Defaults to the creation time.
     */
    public Builder startAt(Instant startAt) {
      this.startAt = startAt;
      return this;
    }

    /**
     * Tie-break among schedules due at the same tick; lower runs first.
     *
     * <p>Optional. Defaults to {@code 0}.
     */
    public Builder executionOrder(int executionOrder) {
      this.executionOrder = executionOrder;
      return this;
    }

    public CampaignDefinition build() {
      return new CampaignDefinition(this);
    }
  }
}
