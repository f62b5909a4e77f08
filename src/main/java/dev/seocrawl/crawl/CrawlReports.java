package dev.seocrawl.crawl;

import java.util.List;

/**
 * SEO reports derived from the inventory and the link graph.
 *
 * @param orphansInSitemap sitemap keys with no inbound internal link
 * @param linkedNotInSitemap linked keys absent from every sitemap
 * @param statusBuckets status-family histogram over the final inventory
 */
public record CrawlReports(
    List<String> orphansInSitemap, List<String> linkedNotInSitemap, StatusBuckets statusBuckets) {

  public CrawlReports {
    orphansInSitemap = orphansInSitemap == null ? List.of() : List.copyOf(orphansInSitemap);
    linkedNotInSitemap = linkedNotInSitemap == null ? List.of() : List.copyOf(linkedNotInSitemap);
  }
}
