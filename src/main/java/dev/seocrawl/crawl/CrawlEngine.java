package dev.seocrawl.crawl;

import dev.seocrawl.config.CrawlerProperties;
import dev.seocrawl.fetch.FetchException;
import dev.seocrawl.fetch.FetchResult;
import dev.seocrawl.fetch.RedirectFetcher;
import dev.seocrawl.url.IgnoredExtensions;
import dev.seocrawl.url.UrlCanonicalizer;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Breadth-first crawl of one site that inventories its URL surface: sitemap URLs are collected
 * first, the HTML link graph is walked from the start URL, and sitemap URLs that are linked but
 * were not reached are resolved in a post-pass. The run is bounded by {@code maxPages} network
 * fetches and by the BFS depth.
 *
 * <p>Nodes are processed in FIFO batches of at most {@code max-concurrency}; a batch completes
 * before the next one is dequeued, which keeps discovery depths breadth-first.
 */
@Service
public class CrawlEngine {

  private static final Logger log = LoggerFactory.getLogger(CrawlEngine.class);

  /** Depth recorded for URLs known only from a sitemap. */
  public static final int SITEMAP_DEPTH = 9999;

  private final RedirectFetcher fetcher;
  private final RobotsPolicyProvider robotsPolicyProvider;
  private final SitemapResolver sitemapResolver;
  private final IgnoredExtensions ignoredExtensions;
  private final CrawlerProperties props;

  public CrawlEngine(
      RedirectFetcher fetcher,
      RobotsPolicyProvider robotsPolicyProvider,
      SitemapResolver sitemapResolver,
      IgnoredExtensions ignoredExtensions,
      CrawlerProperties props) {
    this.fetcher = fetcher;
    this.robotsPolicyProvider = robotsPolicyProvider;
    this.sitemapResolver = sitemapResolver;
    this.ignoredExtensions = ignoredExtensions;
    this.props = props;
  }

  /**
   * Crawl the site of {@code request.startUrl()}.
   *
   * @param request crawl parameters; absent fields use the configured defaults
   * @return the inventory, link graph, consulted sitemaps, statistics and reports
   * @throws IllegalArgumentException if the start URL is not an absolute http(s) URL
   */
  public CrawlResult crawl(CrawlRequest request) {
    long startedAt = System.nanoTime();
    RunContext run = resolve(request);
    log.info(
        "Crawling {} (depth={}, maxPages={}, includeSubdomains={})",
        run.startUrl(),
        run.maxDepth(),
        run.maxPages(),
        run.includeSubdomains());

    List<String> sitemapEndpoints = sitemapEndpoints(run);
    Set<String> fromSitemap = collectSitemapKeys(sitemapEndpoints, run);

    CrawlState state = new CrawlState(run.maxPages());
    for (String key : fromSitemap) {
      state.registerSitemapUrl(key);
    }
    state.enqueue(run.startUrl(), 0);
    String counterpart = UrlCanonicalizer.wwwCounterpart(run.startUrl());
    if (counterpart != null) {
      state.enqueue(counterpart, 0);
    }

    ExecutorService pool =
        Executors.newFixedThreadPool(
            props.maxConcurrency(), new CustomizableThreadFactory("crawl-worker-"));
    try {
      boolean completed = runFrontier(pool, state, run, fromSitemap);
      if (completed) {
        postPass(pool, state, run, fromSitemap);
      }
    } finally {
      pool.shutdownNow();
    }

    CrawlResult result = buildResult(state, sitemapEndpoints, fromSitemap, elapsedMs(startedAt));
    log.info(
        "Crawl of {} finished: {} fetched, {} inventoried, {} edges in {} ms",
        run.startUrl(),
        result.stats().pagesFetched(),
        result.inventory().size(),
        result.edges().size(),
        result.stats().elapsedMs());
    return result;
  }

  private RunContext resolve(CrawlRequest request) {
    String startUrl = request.startUrl().trim();
    URI base = UrlCanonicalizer.parse(startUrl);
    if (base == null || !UrlCanonicalizer.isHttpUrl(startUrl)) {
      throw new IllegalArgumentException("startUrl must be an absolute http(s) URL: " + startUrl);
    }
    int maxDepth = request.depth() != null ? request.depth() : props.defaultDepth();
    int maxPages = request.maxPages() != null ? request.maxPages() : props.maxPages();
    String userAgent =
        request.userAgent() != null && !request.userAgent().isBlank()
            ? request.userAgent()
            : props.userAgent();
    boolean includeSubdomains = Boolean.TRUE.equals(request.includeSubdomains());

    RobotsPolicy robots = RobotsPolicy.allowAll();
    if (props.respectRobots()) {
      String origin = UrlCanonicalizer.origin(startUrl);
      if (origin != null) {
        robots = robotsPolicyProvider.policyFor(origin, userAgent);
      }
    }
    return new RunContext(startUrl, base, maxDepth, maxPages, includeSubdomains, userAgent, robots);
  }

  private List<String> sitemapEndpoints(RunContext run) {
    Set<String> endpoints =
        new LinkedHashSet<>(
            sitemapResolver.discoverEndpoints(run.startUrl(), run.robots().sitemaps()));
    String counterpart = UrlCanonicalizer.wwwCounterpart(run.startUrl());
    if (counterpart != null) {
      endpoints.addAll(sitemapResolver.discoverEndpoints(counterpart, List.of()));
    }
    return List.copyOf(endpoints);
  }

  private Set<String> collectSitemapKeys(List<String> endpoints, RunContext run) {
    Set<String> keys = new LinkedHashSet<>();
    for (String endpoint : endpoints) {
      int remaining = run.maxPages() - keys.size();
      if (remaining <= 0) {
        break;
      }
      for (String url : sitemapResolver.collectUrls(endpoint, run.userAgent(), remaining)) {
        keys.add(UrlCanonicalizer.normalizeForKey(url));
      }
    }
    log.debug("Collected {} sitemap URLs from {} endpoints", keys.size(), endpoints.size());
    return keys;
  }

  /** Returns false when the run was interrupted. */
  private boolean runFrontier(
      ExecutorService pool, CrawlState state, RunContext run, Set<String> fromSitemap) {
    while (state.hasQueued() && state.remainingBudget() > 0) {
      List<Future<?>> batch = new ArrayList<>();
      for (CrawlState.Node node : state.nextBatch(props.maxConcurrency())) {
        batch.add(pool.submit(() -> visit(node, state, run, fromSitemap)));
      }
      if (!awaitAll(batch)) {
        return false;
      }
    }
    return true;
  }

  private void visit(
      CrawlState.Node node, CrawlState state, RunContext run, Set<String> fromSitemap) {
    String key = UrlCanonicalizer.normalizeForKey(node.url());
    if (!state.markSeen(key)) {
      return;
    }
    URI target = UrlCanonicalizer.parse(node.url());
    if (target == null || !isInternal(run, target)) {
      log.debug("Skipping external or malformed URL {}", node.url());
      return;
    }
    if (ignoredExtensions.matches(target)) {
      log.debug("Skipping ignored extension {}", node.url());
      return;
    }
    if (props.respectRobots() && !run.robots().isAllowed(node.url())) {
      log.debug("Disallowed by robots.txt: {}", node.url());
      return;
    }
    if (!state.tryReserveFetch()) {
      state.deferForBudget(node, key);
      return;
    }

    FetchResult result;
    try {
      result = fetcher.fetch(node.url(), run.userAgent());
    } catch (FetchException e) {
      state.releaseFetch();
      log.debug("Dropping {}: {}", node.url(), e.getMessage());
      return;
    }

    Discovery discovery = fromSitemap.contains(key) ? Discovery.BOTH : Discovery.HTML;
    state.recordVisit(
        new InventoryItem(
            node.url(),
            key,
            result.finalUrl(),
            result.status(),
            result.contentType(),
            node.depth(),
            discovery,
            result.redirectChain()));

    if (result.isSuccessful() && result.isHtml()) {
      followLinks(result, key, node.depth(), state, run);
    }

    Duration delay = run.robots().crawlDelay();
    if (delay != null) {
      sleep(delay);
    }
  }

  private void followLinks(
      FetchResult page, String fromKey, int depth, CrawlState state, RunContext run) {
    for (String link : LinkExtractor.extract(page)) {
      URI to = UrlCanonicalizer.parse(link);
      if (to == null || !isInternal(run, to)) {
        continue;
      }
      if (ignoredExtensions.matches(to)) {
        continue;
      }
      String toKey = UrlCanonicalizer.normalizeForKey(link);
      state.addEdge(new Edge(fromKey, toKey));
      if (depth < run.maxDepth()) {
        state.enqueueIfUnseen(link, toKey, depth + 1);
      }
    }
  }

  private void postPass(
      ExecutorService pool, CrawlState state, RunContext run, Set<String> fromSitemap) {
    Set<String> inbound = state.inboundKeys();
    List<String> candidates =
        fromSitemap.stream().filter(inbound::contains).filter(state::isUnfetched).toList();
    int room = state.remainingBudget();
    if (candidates.isEmpty() || room == 0) {
      return;
    }

    List<Future<?>> fetches = new ArrayList<>();
    for (String key : candidates.subList(0, Math.min(room, candidates.size()))) {
      fetches.add(pool.submit(() -> resolveSitemapEntry(key, state, run)));
    }
    awaitAll(fetches);
  }

  private void resolveSitemapEntry(String key, CrawlState state, RunContext run) {
    if (props.respectRobots() && !run.robots().isAllowed(key)) {
      log.debug("Post-pass: disallowed by robots.txt: {}", key);
      return;
    }
    if (!state.tryReserveFetch()) {
      return;
    }
    try {
      FetchResult result = fetcher.fetch(key, run.userAgent());
      state.resolvePlaceholder(key, result, run.maxDepth() + 1);
    } catch (FetchException e) {
      state.releaseFetch();
      log.warn("Post-pass could not resolve sitemap URL {}: {}", key, e.getMessage());
    }
  }

  private CrawlResult buildResult(
      CrawlState state, List<String> sitemapEndpoints, Set<String> fromSitemap, long elapsedMs) {
    List<InventoryItem> inventory = state.inventory();
    Set<String> inbound = state.inboundKeys();

    List<String> orphans = fromSitemap.stream().filter(k -> !inbound.contains(k)).toList();
    List<String> linkedNotInSitemap =
        inbound.stream().filter(k -> !fromSitemap.contains(k)).toList();
    CrawlReports reports =
        new CrawlReports(orphans, linkedNotInSitemap, StatusBuckets.of(inventory));

    int pagesFromHtml =
        (int) inventory.stream().filter(i -> i.discoveredBy() != Discovery.SITEMAP).count();
    CrawlStats stats =
        new CrawlStats(state.fetchedCount(), fromSitemap.size(), pagesFromHtml, elapsedMs);

    return new CrawlResult(inventory, state.edges(), sitemapEndpoints, stats, reports);
  }

  private static boolean isInternal(RunContext run, URI target) {
    return UrlCanonicalizer.isInternal(run.base(), target, run.includeSubdomains());
  }

  /** Wait for every future; returns false if the calling thread was interrupted. */
  private static boolean awaitAll(List<Future<?>> futures) {
    for (Future<?> future : futures) {
      try {
        future.get();
      } catch (ExecutionException e) {
        log.warn("Crawl task failed unexpectedly", e.getCause());
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        futures.forEach(f -> f.cancel(true));
        log.warn("Crawl interrupted, returning partial results");
        return false;
      }
    }
    return true;
  }

  private static void sleep(Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  private static long elapsedMs(long startedAt) {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
  }

  record RunContext(
      String startUrl,
      URI base,
      int maxDepth,
      int maxPages,
      boolean includeSubdomains,
      String userAgent,
      RobotsPolicy robots) {}
}
