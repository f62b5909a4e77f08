package dev.seocrawl.audit;

import dev.seocrawl.fetch.RedirectHop;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Indexability signals of one URL.
 *
 * @param url URL as requested
 * @param finalUrl URL after redirects
 * @param status final HTTP status; 0 when the URL could not be fetched
 * @param contentType final content type, if any
 * @param canonical absolute canonical URL, if declared and resolvable
 * @param metaRobots merged meta robots directives; null when no tag was found
 * @param xRobots merged {@code X-Robots-Tag} directives; null when no header was sent
 * @param noindex per-source noindex flags
 * @param hreflang alternates in document order
 * @param issues detected problems, in detection order
 * @param redirectChain hops followed
 */
public record AuditResult(
    String url,
    String finalUrl,
    int status,
    @Nullable String contentType,
    @Nullable String canonical,
    @Nullable RobotsDirectives metaRobots,
    @Nullable RobotsDirectives xRobots,
    NoindexFlags noindex,
    List<HreflangLink> hreflang,
    List<String> issues,
    List<RedirectHop> redirectChain) {

  public static final String FETCH_FAILED = "fetch failed";
  public static final String MULTIPLE_CANONICALS = "multiple canonicals";
  public static final String CONFLICTING_NOINDEX = "conflicting noindex between meta and header";
  public static final String CANONICAL_OFF_DOMAIN = "canonical points to different eTLD+1";
  public static final String INVALID_CANONICAL = "invalid canonical URL";

  public AuditResult {
    hreflang = hreflang == null ? List.of() : List.copyOf(hreflang);
    issues = issues == null ? List.of() : List.copyOf(issues);
    redirectChain = redirectChain == null ? List.of() : List.copyOf(redirectChain);
  }

  /** Result for a URL that could not be fetched at all. */
  public static AuditResult fetchFailed(String url) {
    return new AuditResult(
        url,
        url,
        0,
        null,
        null,
        null,
        null,
        NoindexFlags.NONE,
        List.of(),
        List.of(FETCH_FAILED),
        List.of());
  }
}
