package dev.seocrawl.api;

import dev.seocrawl.audit.AuditRequest;
import dev.seocrawl.audit.IndexabilityAuditor;
import dev.seocrawl.crawl.CrawlEngine;
import dev.seocrawl.crawl.CrawlRequest;
import dev.seocrawl.crawl.CrawlResult;
import jakarta.validation.Valid;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter over the crawl engine and the indexability auditor. Invalid bodies are turned into
 * 400 Problem Details by {@link dev.seocrawl.config.GlobalExceptionHandler}.
 */
@RestController
public class SeoController {

  private static final Logger log = LoggerFactory.getLogger(SeoController.class);

  private final CrawlEngine crawlEngine;
  private final IndexabilityAuditor auditor;
  private final CrawlSnapshotWriter snapshotWriter;

  public SeoController(
      CrawlEngine crawlEngine, IndexabilityAuditor auditor, CrawlSnapshotWriter snapshotWriter) {
    this.crawlEngine = crawlEngine;
    this.auditor = auditor;
    this.snapshotWriter = snapshotWriter;
  }

  /** GET /healthz - liveness. */
  @GetMapping("/healthz")
  public ApiResponses.Status health() {
    return new ApiResponses.Status(true, null);
  }

  /** GET /api/crawl - readiness of the crawl endpoint. */
  @GetMapping("/api/crawl")
  public ApiResponses.Status crawlReady() {
    return new ApiResponses.Status(true, "crawl endpoint ready");
  }

  /** POST /api/crawl - crawl a site and snapshot the result. */
  @PostMapping("/api/crawl")
  public ResponseEntity<ApiResponses.CrawlResponse> crawl(
      @Valid @RequestBody CrawlRequest request) {
    CrawlResult result = crawlEngine.crawl(request);
    String snapshotFile = null;
    if (snapshotWriter.enabled()) {
      try {
        snapshotFile = snapshotWriter.write(request, result).toString();
      } catch (IOException e) {
        log.warn("Could not write crawl snapshot for {}: {}", request.startUrl(), e.getMessage());
      }
    }
    return ResponseEntity.ok(new ApiResponses.CrawlResponse(true, snapshotFile, result));
  }

  /** POST /api/audit - audit URLs for indexability. */
  @PostMapping("/api/audit")
  public ResponseEntity<ApiResponses.AuditResponse> audit(
      @Valid @RequestBody AuditRequest request) {
    return ResponseEntity.ok(new ApiResponses.AuditResponse(true, auditor.audit(request)));
  }
}
