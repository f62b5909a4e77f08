package dev.seocrawl.api;

import dev.seocrawl.audit.AuditResult;
import dev.seocrawl.crawl.CrawlResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/** Response bodies of the REST adapter. */
public final class ApiResponses {

  private ApiResponses() {}

  /** {@code POST /api/crawl}. */
  public record CrawlResponse(boolean ok, @Nullable String snapshotFile, CrawlResult output) {}

  /** {@code POST /api/audit}. */
  public record AuditResponse(boolean ok, List<AuditResult> results) {}

  /** Health and readiness probes. */
  public record Status(boolean ok, @Nullable String msg) {}
}
