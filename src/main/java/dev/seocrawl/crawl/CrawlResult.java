package dev.seocrawl.crawl;

import java.util.List;

/**
 * Output of a crawl run. Inventory and edge order depend on network timing; only the reports are
 * deterministic for identical responses.
 *
 * @param inventory one item per normalized key
 * @param edges observed internal links, not deduplicated
 * @param sitemap sitemap endpoints consulted (not the URLs they list)
 * @param stats run statistics
 * @param reports derived SEO reports
 */
public record CrawlResult(
    List<InventoryItem> inventory,
    List<Edge> edges,
    List<String> sitemap,
    CrawlStats stats,
    CrawlReports reports) {

  public CrawlResult {
    inventory = inventory == null ? List.of() : List.copyOf(inventory);
    edges = edges == null ? List.of() : List.copyOf(edges);
    sitemap = sitemap == null ? List.of() : List.copyOf(sitemap);
  }
}
