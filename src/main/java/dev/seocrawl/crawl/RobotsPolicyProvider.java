package dev.seocrawl.crawl;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRulesParser;
import dev.seocrawl.config.CrawlerProperties;
import dev.seocrawl.fetch.FetchException;
import dev.seocrawl.fetch.FetchResult;
import dev.seocrawl.fetch.RedirectFetcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Fetches and caches {@code /robots.txt} per origin. Entries live for {@code
 * seocrawl.crawler.robots-cache-ttl}; concurrent first loads of the same origin may both hit the
 * network, but the first stored entry is the one every caller sees until it expires.
 *
 * <p>Any failure (network error, non-2xx, unparseable content) yields the allow-all policy.
 */
@Component
public class RobotsPolicyProvider {

  private static final Logger log = LoggerFactory.getLogger(RobotsPolicyProvider.class);

  private final RedirectFetcher fetcher;
  private final Clock clock;
  private final Duration ttl;
  private final ConcurrentMap<String, CachedPolicy> cache = new ConcurrentHashMap<>();

  public RobotsPolicyProvider(RedirectFetcher fetcher, Clock clock, CrawlerProperties props) {
    this.fetcher = fetcher;
    this.clock = clock;
    this.ttl = props.robotsCacheTtl();
  }

  /**
   * Return the robots policy of {@code origin} for {@code userAgent}.
   *
   * @param origin scheme and authority, e.g. {@code https://example.com}
   * @param userAgent full user-agent string; its product token selects the robots group
   */
  public RobotsPolicy policyFor(String origin, String userAgent) {
    String key = origin + "#" + productToken(userAgent);
    Instant now = clock.instant();
    CachedPolicy cached = cache.get(key);
    if (cached != null && cached.isFresh(now)) {
      return cached.policy();
    }

    CachedPolicy loaded = new CachedPolicy(load(origin, userAgent), now.plus(ttl));
    return cache
        .merge(key, loaded, (existing, fresh) -> existing.isFresh(now) ? existing : fresh)
        .policy();
  }

  /** Drop every cached entry. */
  public void clear() {
    cache.clear();
  }

  RobotsPolicy load(String origin, String userAgent) {
    String robotsUrl = origin + "/robots.txt";
    FetchResult result;
    try {
      result = fetcher.fetch(robotsUrl, userAgent);
    } catch (FetchException e) {
      log.debug("robots.txt not available at {}: {}", robotsUrl, e.getMessage());
      return RobotsPolicy.allowAll();
    }
    if (!result.isSuccessful()) {
      log.debug("robots.txt at {} answered {}, allowing all", robotsUrl, result.status());
      return RobotsPolicy.allowAll();
    }

    String contentType = result.contentType() != null ? result.contentType() : "text/plain";
    try {
      BaseRobotRules rules =
          newParser()
              .parseContent(
                  result.finalUrl(), result.body(), contentType, List.of(productToken(userAgent)));
      log.debug("Loaded robots.txt for {} ({} sitemaps)", origin, rules.getSitemaps().size());
      return RobotsPolicy.of(rules);
    } catch (RuntimeException e) {
      log.warn("Could not parse robots.txt at {}: {}", robotsUrl, e.getMessage());
      return RobotsPolicy.allowAll();
    }
  }

  /**
   * crawler-commons turns a crawl-delay above its limit into disallow-all rules. The delay is
   * reported unchanged instead and the engine applies it as a politeness pause.
   */
  private static SimpleRobotRulesParser newParser() {
    SimpleRobotRulesParser parser = new SimpleRobotRulesParser();
    parser.setMaxCrawlDelay(Long.MAX_VALUE);
    return parser;
  }

  /**
   * Robots product token of a user-agent string: the part before the first {@code /} or space,
   * lower-cased. {@code "Mozilla/5.0 (...)"} becomes {@code "mozilla"}.
   */
  static String productToken(String userAgent) {
    String trimmed = userAgent == null ? "" : userAgent.trim();
    int end = trimmed.length();
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c == '/' || Character.isWhitespace(c)) {
        end = i;
        break;
      }
    }
    String token = trimmed.substring(0, end).toLowerCase(Locale.ROOT);
    return token.isEmpty() ? "*" : token;
  }

  private record CachedPolicy(RobotsPolicy policy, Instant expiresAt) {

    boolean isFresh(Instant now) {
      return expiresAt.isAfter(now);
    }
  }
}
