package dev.seocrawl.crawl;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How a URL entered the inventory. Provenance only ever strengthens towards {@link #BOTH}. */
public enum Discovery {
  /** Found by following an {@code <a href>} during the BFS. */
  HTML,
  /** Listed in a sitemap. */
  SITEMAP,
  /** Found both ways. */
  BOTH;

  /**
   * Combine two provenances. Differing sources, or either side already {@link #BOTH}, yield
   * {@link #BOTH}; the result never regresses.
   */
  public Discovery merge(Discovery other) {
    if (this == other) {
      return this;
    }
    return BOTH;
  }

  @JsonValue
  public String jsonValue() {
    return name().toLowerCase(Locale.ROOT);
  }
}
