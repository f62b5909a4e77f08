package dev.seocrawl.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.seocrawl.audit.AuditRequest;
import dev.seocrawl.audit.AuditResult;
import dev.seocrawl.audit.IndexabilityAuditor;
import dev.seocrawl.crawl.CrawlEngine;
import dev.seocrawl.crawl.CrawlRequest;
import dev.seocrawl.crawl.CrawlResult;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing the crawler and the indexability auditor as tool methods.
 *
 * <p>Tool methods never throw: arguments are validated against the request records' constraints,
 * and every failure comes back as an {@code Error: ...} string. Successful calls return the result
 * as pretty-printed JSON behind a {@code RESULT_JSON:} marker so clients can extract it.
 *
 * @see McpToolConfig
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final String RESULT_PREFIX = "RESULT_JSON:\n```json\n";
  static final String RESULT_SUFFIX = "\n```";

  private final CrawlEngine crawlEngine;
  private final IndexabilityAuditor auditor;
  private final ObjectMapper objectMapper;
  private final Validator validator;

  public McpToolService(
      CrawlEngine crawlEngine,
      IndexabilityAuditor auditor,
      ObjectMapper objectMapper,
      Validator validator) {
    this.crawlEngine = crawlEngine;
    this.auditor = auditor;
    this.objectMapper = objectMapper;
    this.validator = validator;
  }

  /** Crawls a site and returns its URL inventory, link graph and SEO reports. */
  @Tool(
      name = "crawl_site",
      description =
          "Discover the internal URLs of a site from its sitemaps and HTML links. "
              + "Returns inventory, internal link edges, orphan and unlisted URL reports, "
              + "and a status histogram.")
  public String crawlSite(
      @ToolParam(description = "Absolute http(s) start URL") @Nullable String startUrl,
      @ToolParam(description = "Maximum link depth (0-6, default 2)", required = false)
          @Nullable Integer depth,
      @ToolParam(description = "Maximum number of fetches (1-5000, default 500)", required = false)
          @Nullable Integer maxPages,
      @ToolParam(description = "Treat subdomains of the same site as internal", required = false)
          @Nullable Boolean includeSubdomains,
      @ToolParam(description = "User-Agent header override", required = false)
          @Nullable String userAgent) {
    try {
      if (startUrl == null || startUrl.isBlank()) {
        return "Error: startUrl must not be empty. Provide an absolute http(s) URL.";
      }
      CrawlRequest request =
          new CrawlRequest(startUrl, depth, maxPages, includeSubdomains, userAgent);
      String violations = violations(request);
      if (violations != null) {
        return "Error: " + violations;
      }
      CrawlResult result = crawlEngine.crawl(request);
      return asResultJson(result);
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("crawl_site failed for {}", startUrl, e);
      return "Error crawling site: " + e.getMessage();
    }
  }

  /** Audits a list of URLs for indexability signals. */
  @Tool(
      name = "audit_indexability",
      description =
          "Audit URLs for indexability: final status after redirects, canonical, "
              + "meta robots and X-Robots-Tag noindex, hreflang alternates, and detected issues.")
  public String auditIndexability(
      @ToolParam(description = "URLs to audit (1-200)") @Nullable List<String> urls,
      @ToolParam(description = "User-Agent header override", required = false)
          @Nullable String userAgent) {
    try {
      if (urls == null || urls.isEmpty()) {
        return "Error: urls must contain between 1 and " + AuditRequest.MAX_URLS + " URLs.";
      }
      AuditRequest request = new AuditRequest(urls, userAgent);
      String violations = violations(request);
      if (violations != null) {
        return "Error: " + violations;
      }
      List<AuditResult> results = auditor.audit(request);
      return asResultJson(Map.of("results", results));
    } catch (IllegalArgumentException e) {
      return "Error: " + e.getMessage();
    } catch (Exception e) {
      log.warn("audit_indexability failed", e);
      return "Error auditing URLs: " + e.getMessage();
    }
  }

  /** Liveness check for MCP clients. */
  @Tool(name = "crawler_health", description = "Liveness check of the crawler MCP server.")
  public String crawlerHealth() {
    return "OK: MCP server alive";
  }

  private <T> @Nullable String violations(T request) {
    Set<ConstraintViolation<T>> violations = validator.validate(request);
    if (violations.isEmpty()) {
      return null;
    }
    return violations.stream()
        .map(v -> v.getPropertyPath() + ": " + v.getMessage())
        .sorted()
        .collect(Collectors.joining("; "));
  }

  private String asResultJson(Object value) throws JsonProcessingException {
    return RESULT_PREFIX
        + objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value)
        + RESULT_SUFFIX;
  }
}
