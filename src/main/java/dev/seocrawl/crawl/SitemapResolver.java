package dev.seocrawl.crawl;

import crawlercommons.sitemaps.AbstractSiteMap;
import crawlercommons.sitemaps.SiteMap;
import crawlercommons.sitemaps.SiteMapIndex;
import crawlercommons.sitemaps.SiteMapParser;
import crawlercommons.sitemaps.SiteMapURL;
import crawlercommons.sitemaps.UnknownFormatException;
import dev.seocrawl.fetch.FetchException;
import dev.seocrawl.fetch.FetchResult;
import dev.seocrawl.fetch.RedirectFetcher;
import dev.seocrawl.url.UrlCanonicalizer;
import java.io.IOException;
import java.net.URI;
import java.net.URL;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Finds sitemap endpoints for a site and expands them, including nested sitemap indexes, into a
 * flat URL list using crawler-commons. Missing or unparseable sitemaps contribute nothing.
 */
@Component
public class SitemapResolver {

  private static final Logger log = LoggerFactory.getLogger(SitemapResolver.class);

  private final RedirectFetcher fetcher;

  public SitemapResolver(RedirectFetcher fetcher) {
    this.fetcher = fetcher;
  }

  /**
   * Candidate sitemap endpoints: the robots-declared ones in order, then {@code
   * <origin>/sitemap.xml}, without duplicates.
   */
  public List<String> discoverEndpoints(String startUrl, List<String> robotsSitemaps) {
    Set<String> endpoints = new LinkedHashSet<>(robotsSitemaps);
    String origin = UrlCanonicalizer.origin(startUrl);
    if (origin != null) {
      endpoints.add(origin + "/sitemap.xml");
    }
    return List.copyOf(endpoints);
  }

  /**
   * Expand one sitemap endpoint into at most {@code limit} page URLs. Indexes are followed
   * recursively in declaration order with the remaining budget; an index that lists itself, or
   * a cycle of indexes, is visited once.
   */
  public List<String> collectUrls(String endpoint, String userAgent, int limit) {
    return collect(endpoint, userAgent, limit, new HashSet<>());
  }

  private List<String> collect(String endpoint, String userAgent, int limit, Set<String> visited) {
    if (limit <= 0 || !visited.add(endpoint)) {
      return List.of();
    }

    AbstractSiteMap parsed = fetchAndParse(endpoint, userAgent);
    if (parsed instanceof SiteMapIndex index) {
      List<String> urls = new ArrayList<>();
      for (AbstractSiteMap child : index.getSitemaps()) {
        int remaining = limit - urls.size();
        if (remaining <= 0) {
          break;
        }
        urls.addAll(collect(child.getUrl().toString(), userAgent, remaining, visited));
      }
      return urls;
    }
    if (parsed instanceof SiteMap siteMap) {
      return siteMap.getSiteMapUrls().stream()
          .map(SiteMapURL::getUrl)
          .map(URL::toString)
          .limit(limit)
          .toList();
    }
    return List.of();
  }

  private @Nullable AbstractSiteMap fetchAndParse(String endpoint, String userAgent) {
    try {
      FetchResult result = fetcher.fetch(endpoint, userAgent);
      if (!result.isSuccessful() || result.body().length == 0) {
        log.debug("Sitemap not available at {}: status {}", endpoint, result.status());
        return null;
      }
      return new SiteMapParser(false)
          .parseSiteMap(result.body(), URI.create(result.finalUrl()).toURL());
    } catch (FetchException | IOException | UnknownFormatException e) {
      log.debug("Sitemap not available at {}: {}", endpoint, e.getMessage());
    } catch (IllegalArgumentException e) {
      log.debug("Invalid sitemap URL {}: {}", endpoint, e.getMessage());
    }
    return null;
  }
}
