package dev.seocrawl.crawl;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.jspecify.annotations.Nullable;

/**
 * Input of a crawl run. Absent fields fall back to {@code seocrawl.crawler.*} defaults.
 *
 * <p>The compact constructor enforces the structural invariants (non-blank start URL,
 * non-negative depth and page budget). The bean-validation bounds are the tighter limits applied
 * by the MCP and REST adapters.
 *
 * @param startUrl absolute http(s) URL where the BFS starts
 * @param depth maximum BFS depth (default 2)
 * @param maxPages maximum number of network fetches for the whole run (default 500)
 * @param includeSubdomains treat other hosts of the same eTLD+1 as internal
 * @param userAgent user agent override
 */
public record CrawlRequest(
    @NotBlank String startUrl,
    @Nullable @Min(0) @Max(6) Integer depth,
    @Nullable @Min(1) @Max(5000) Integer maxPages,
    @Nullable Boolean includeSubdomains,
    @Nullable String userAgent) {

  public CrawlRequest {
    if (startUrl == null || startUrl.isBlank()) {
      throw new IllegalArgumentException("startUrl must not be blank");
    }
    if (depth != null && depth < 0) {
      throw new IllegalArgumentException("depth must be >= 0");
    }
    if (maxPages != null && maxPages < 0) {
      throw new IllegalArgumentException("maxPages must be >= 0");
    }
  }

  /** Request with every optional field left to the configured defaults. */
  public static CrawlRequest of(String startUrl) {
    return new CrawlRequest(startUrl, null, null, null, null);
  }
}
