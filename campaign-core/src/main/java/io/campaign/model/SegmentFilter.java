package io.campaign.model;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Declarative recipient filter.
 *
 * <p>Dimensions combine with AND; values inside one allow-list combine with OR. A dimension
 * left unset imposes no constraint, so {@link #matchAll()} selects every recipient.
 */
public final class SegmentFilter {
  private static final SegmentFilter MATCH_ALL = builder().build();

  private final Integer minActivityScore;
  private final Set<String> tiers;
  private final Set<String> countries;
  private final Set<String> languages;
  private final Instant registeredAfter;
  private final Instant registeredBefore;

  private SegmentFilter(Builder builder) {
    this.minActivityScore = builder.minActivityScore;
    this.tiers = immutable(builder.tiers);
    this.countries = immutable(builder.countries);
    this.languages = immutable(builder.languages);
    this.registeredAfter = builder.registeredAfter;
    this.registeredBefore = builder.registeredBefore;
    if (registeredAfter != null && registeredBefore != null && registeredAfter.isAfter(registeredBefore)) {
      throw new IllegalArgumentException("registeredAfter must not be after registeredBefore");
    }
  }

  public static SegmentFilter matchAll() {
    return MATCH_ALL;
  }

  public static Builder builder() {
    return new Builder();
  }

  public Integer minActivityScore() {
    return minActivityScore;
  }

  public Set<String> tiers() {
    return tiers;
  }

  public Set<String> countries() {
    return countries;
  }

  public Set<String> languages() {
    return languages;
  }

  public Instant registeredAfter() {
    return registeredAfter;
  }

  public Instant registeredBefore() {
    return registeredBefore;
  }

  public boolean isEmpty() {
    return minActivityScore == null && tiers.isEmpty() && countries.isEmpty()
        && languages.isEmpty() && registeredAfter == null && registeredBefore == null;
  }

  private static Set<String> immutable(Set<String> values) {
    return values.isEmpty() ? Set.of() : Collections.unmodifiableSet(new TreeSet<>(values));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof SegmentFilter other)) return false;
    return Objects.equals(minActivityScore, other.minActivityScore)
        && tiers.equals(other.tiers)
        && countries.equals(other.countries)
        && languages.equals(other.languages)
        && Objects.equals(registeredAfter, other.registeredAfter)
        && Objects.equals(registeredBefore, other.registeredBefore);
  }

  @Override
  public int hashCode() {
    return Objects.hash(minActivityScore, tiers, countries, languages, registeredAfter, registeredBefore);
  }

  @Override
  public String toString() {
    return "SegmentFilter{minActivityScore=" + minActivityScore + ", tiers=" + tiers
        + ", countries=" + countries + ", languages=" + languages
        + ", registeredAfter=" + registeredAfter + ", registeredBefore=" + registeredBefore + "}";
  }

  public static final class Builder {
    private Integer minActivityScore;
    private final Set<String> tiers = new TreeSet<>();
    private final Set<String> countries = new TreeSet<>();
    private final Set<String> languages = new TreeSet<>();
    private Instant registeredAfter;
    private Instant registeredBefore;

    private Builder() {
    }

    /** Minimum activity score, inclusive. */
    public Builder minActivityScore(Integer minActivityScore) {
      this.minActivityScore = minActivityScore;
      return this;
    }

    public Builder tiers(Collection<String> tiers) {
      addAll(this.tiers, tiers);
      return this;
    }

    public Builder tiers(String... tiers) {
      return tiers(Arrays.asList(tiers));
    }

    public Builder countries(Collection<String> countries) {
      addAll(this.countries, countries);
      return this;
    }

    public Builder countries(String... countries) {
      return countries(Arrays.asList(countries));
    }

    public Builder languages(Collection<String> languages) {
      addAll(this.languages, languages);
      return this;
    }

    public Builder languages(String... languages) {
      return languages(Arrays.asList(languages));
    }

    /** Registration lower bound, inclusive. */
    public Builder registeredAfter(Instant registeredAfter) {
      this.registeredAfter = registeredAfter;
      return this;
    }

    /** Registration upper bound, inclusive. */
    public Builder registeredBefore(Instant registeredBefore) {
      this.registeredBefore = registeredBefore;
      return this;
    }

    public SegmentFilter build() {
      return new SegmentFilter(this);
    }

    private static void addAll(Set<String> target, Collection<String> values) {
      if (values == null) {
        return;
      }
      for (String value : values) {
        if (value != null && !value.isBlank()) {
          target.add(value.trim());
        }
      }
    }
  }
}
