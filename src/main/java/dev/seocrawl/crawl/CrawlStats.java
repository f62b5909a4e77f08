package dev.seocrawl.crawl;

/**
 * Run statistics.
 *
 * @param pagesFetched successful network fetches, BFS plus post-pass
 * @param pagesFromSitemap distinct normalized URLs collected from sitemaps
 * @param pagesFromHtml inventory items whose provenance includes HTML discovery
 * @param elapsedMs wall-clock duration of the run
 */
public record CrawlStats(
    int pagesFetched, int pagesFromSitemap, int pagesFromHtml, long elapsedMs) {}
