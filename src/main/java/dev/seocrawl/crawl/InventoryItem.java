package dev.seocrawl.crawl;

import dev.seocrawl.fetch.RedirectHop;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * One known URL of the crawled site, keyed by its normalized form.
 *
 * @param url URL as originally requested or listed
 * @param normalizedUrl deduplication key
 * @param finalUrl URL after redirects; equals the key for unfetched sitemap entries
 * @param status HTTP status of the final response; 0 when never fetched
 * @param contentType final response content type, if any
 * @param depth BFS depth at first discovery; {@value CrawlEngine#SITEMAP_DEPTH} for sitemap-only
 *     placeholders
 * @param discoveredBy provenance
 * @param redirectChain hops followed when the URL was fetched
 */
public record InventoryItem(
    String url,
    String normalizedUrl,
    String finalUrl,
    int status,
    @Nullable String contentType,
    int depth,
    Discovery discoveredBy,
    List<RedirectHop> redirectChain) {

  public InventoryItem {
    redirectChain = redirectChain == null ? List.of() : List.copyOf(redirectChain);
  }

  /** Unfetched entry for a URL known only from a sitemap. */
  public static InventoryItem sitemapPlaceholder(String key) {
    return new InventoryItem(
        key, key, key, 0, null, CrawlEngine.SITEMAP_DEPTH, Discovery.SITEMAP, List.of());
  }

  /** Same item with a different provenance. */
  public InventoryItem withDiscoveredBy(Discovery discovery) {
    return new InventoryItem(
        url, normalizedUrl, finalUrl, status, contentType, depth, discovery, redirectChain);
  }

  public boolean fetched() {
    return status != 0;
  }
}
