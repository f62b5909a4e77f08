package dev.seocrawl.audit;

import dev.seocrawl.config.CrawlerProperties;
import dev.seocrawl.fetch.FetchException;
import dev.seocrawl.fetch.FetchResult;
import dev.seocrawl.fetch.HtmlDocuments;
import dev.seocrawl.fetch.RedirectFetcher;
import dev.seocrawl.url.UrlCanonicalizer;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

/**
 * Audits URLs for indexability signals: final status after redirects, canonical, meta robots,
 * {@code X-Robots-Tag}, and hreflang alternates. URLs are independent of each other and are
 * fetched on a pool bounded by {@code max-concurrency}. Results keep the input order.
 */
@Service
public class IndexabilityAuditor {

  private static final Logger log = LoggerFactory.getLogger(IndexabilityAuditor.class);

  static final String X_ROBOTS_TAG = "X-Robots-Tag";

  private final RedirectFetcher fetcher;
  private final CrawlerProperties props;

  public IndexabilityAuditor(RedirectFetcher fetcher, CrawlerProperties props) {
    this.fetcher = fetcher;
    this.props = props;
  }

  public List<AuditResult> audit(AuditRequest request) {
    String userAgent =
        request.userAgent() != null && !request.userAgent().isBlank()
            ? request.userAgent()
            : props.userAgent();
    int poolSize = Math.min(props.maxConcurrency(), request.urls().size());
    log.info("Auditing {} URLs", request.urls().size());

    ExecutorService pool =
        Executors.newFixedThreadPool(poolSize, new CustomizableThreadFactory("audit-worker-"));
    try {
      List<Future<AuditResult>> futures = new ArrayList<>();
      for (String url : request.urls()) {
        futures.add(pool.submit(() -> auditUrl(url, userAgent)));
      }
      return collect(request.urls(), futures);
    } finally {
      pool.shutdownNow();
    }
  }

  /** Audit a single URL. Never throws; fetch failures are reported as an issue. */
  public AuditResult auditUrl(String url, String userAgent) {
    FetchResult result;
    try {
      result = fetcher.fetch(url, userAgent);
    } catch (FetchException e) {
      log.debug("Audit fetch failed for {}: {}", url, e.getMessage());
      return AuditResult.fetchFailed(url);
    }

    RobotsDirectives xRobots = null;
    for (String value : result.headerValues(X_ROBOTS_TAG)) {
      xRobots = RobotsDirectives.merge(xRobots, RobotsDirectives.parse(value));
    }

    HtmlSignals signals = HtmlSignals.NONE;
    if (result.status() != HttpStatus.NO_CONTENT.value()
        && result.isHtml()
        && result.body().length > 0) {
      signals = HtmlSignals.extract(HtmlDocuments.parse(result), result.finalUrl());
    }

    List<String> issues = new ArrayList<>();
    if (signals.canonicalCount() > 1) {
      issues.add(AuditResult.MULTIPLE_CANONICALS);
    }

    NoindexFlags noindex =
        new NoindexFlags(
            signals.metaRobots() != null && signals.metaRobots().noindex(),
            xRobots != null && xRobots.noindex());
    if (noindex.conflicting()) {
      issues.add(AuditResult.CONFLICTING_NOINDEX);
    }

    if (signals.canonicalInvalid()) {
      issues.add(AuditResult.INVALID_CANONICAL);
    } else if (signals.canonical() != null && isOffDomain(result.finalUrl(), signals.canonical())) {
      issues.add(AuditResult.CANONICAL_OFF_DOMAIN);
    }

    return new AuditResult(
        url,
        result.finalUrl(),
        result.status(),
        result.contentType(),
        signals.canonical(),
        signals.metaRobots(),
        xRobots,
        noindex,
        signals.hreflang(),
        issues,
        result.redirectChain());
  }

  private static boolean isOffDomain(String pageUrl, String canonical) {
    URI page = UrlCanonicalizer.parse(pageUrl);
    URI target = UrlCanonicalizer.parse(canonical);
    return page != null && target != null && !UrlCanonicalizer.sameEtldPlusOne(page, target);
  }

  private static List<AuditResult> collect(List<String> urls, List<Future<AuditResult>> futures) {
    List<AuditResult> results = new ArrayList<>(futures.size());
    boolean interrupted = false;
    for (int i = 0; i < futures.size(); i++) {
      Future<AuditResult> future = futures.get(i);
      if (interrupted) {
        future.cancel(true);
        results.add(AuditResult.fetchFailed(urls.get(i)));
        continue;
      }
      try {
        results.add(future.get());
      } catch (ExecutionException e) {
        log.warn("Audit of {} failed unexpectedly", urls.get(i), e.getCause());
        results.add(AuditResult.fetchFailed(urls.get(i)));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Audit interrupted, remaining URLs reported as failed");
        interrupted = true;
        results.add(AuditResult.fetchFailed(urls.get(i)));
      }
    }
    return results;
  }
}
