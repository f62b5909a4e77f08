package dev.seocrawl.config;

import java.time.Duration;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised defaults for crawl and audit runs, bound from {@code seocrawl.crawler.*}.
 *
 * <p>These values are substituted whenever a request leaves the corresponding field absent. They
 * are not part of any request signature. {@code application.yml} maps the {@code CRAWLER_*}
 * environment variables onto each property.
 *
 * @param defaultDepth BFS depth used when a crawl request omits it
 * @param maxPages fetch budget used when a crawl request omits it
 * @param userAgent user agent used when a request omits it
 * @param fallbackUserAgent browser user agent retried when the origin blocks the first attempt
 * @param maxConcurrency number of network operations allowed in flight per run
 * @param respectRobots whether the crawl engine consults robots.txt
 * @param requestTimeout deadline applied to every network request
 * @param connectTimeout TCP/TLS connect timeout
 * @param maxBodyBytes response bodies are truncated past this size
 * @param robotsCacheTtl how long a parsed robots.txt stays cached per origin
 * @param ignoreExtensionsFile optional filesystem override for the ignored-extension list
 */
@ConfigurationProperties(prefix = "seocrawl.crawler")
public record CrawlerProperties(
    int defaultDepth,
    int maxPages,
    String userAgent,
    String fallbackUserAgent,
    int maxConcurrency,
    boolean respectRobots,
    Duration requestTimeout,
    Duration connectTimeout,
    long maxBodyBytes,
    Duration robotsCacheTtl,
    @Nullable String ignoreExtensionsFile) {

  public static final String DEFAULT_USER_AGENT = "mcp-crawler";

  public static final String DEFAULT_FALLBACK_USER_AGENT =
      "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 "
          + "(KHTML, like Gecko) Chrome/124.0.0.0 Safari/537.36";

  public CrawlerProperties {
    if (defaultDepth < 0) {
      throw new IllegalStateException(
          "seocrawl.crawler.default-depth must be >= 0, got: " + defaultDepth);
    }
    if (maxPages < 1) {
      throw new IllegalStateException("seocrawl.crawler.max-pages must be >= 1, got: " + maxPages);
    }
    if (maxConcurrency < 1) {
      throw new IllegalStateException(
          "seocrawl.crawler.max-concurrency must be >= 1, got: " + maxConcurrency);
    }
    if (maxBodyBytes < 1) {
      throw new IllegalStateException(
          "seocrawl.crawler.max-body-bytes must be >= 1, got: " + maxBodyBytes);
    }
    userAgent = userAgent == null || userAgent.isBlank() ? DEFAULT_USER_AGENT : userAgent;
    fallbackUserAgent =
        fallbackUserAgent == null || fallbackUserAgent.isBlank()
            ? DEFAULT_FALLBACK_USER_AGENT
            : fallbackUserAgent;
    requestTimeout = positiveOr(requestTimeout, Duration.ofSeconds(20));
    connectTimeout = positiveOr(connectTimeout, Duration.ofSeconds(10));
    robotsCacheTtl = positiveOr(robotsCacheTtl, Duration.ofMinutes(30));
  }

  /** Defaults matching {@code application.yml}; used by tests and non-Spring callers. */
  public static CrawlerProperties defaults() {
    return new CrawlerProperties(
        2,
        500,
        DEFAULT_USER_AGENT,
        DEFAULT_FALLBACK_USER_AGENT,
        6,
        false,
        Duration.ofSeconds(20),
        Duration.ofSeconds(10),
        10L * 1024 * 1024,
        Duration.ofMinutes(30),
        null);
  }

  /** Copy with robots.txt handling switched on or off. */
  public CrawlerProperties withRespectRobots(boolean respect) {
    return new CrawlerProperties(
        defaultDepth,
        maxPages,
        userAgent,
        fallbackUserAgent,
        maxConcurrency,
        respect,
        requestTimeout,
        connectTimeout,
        maxBodyBytes,
        robotsCacheTtl,
        ignoreExtensionsFile);
  }

  private static Duration positiveOr(@Nullable Duration value, Duration fallback) {
    return value == null || value.isZero() || value.isNegative() ? fallback : value;
  }
}
