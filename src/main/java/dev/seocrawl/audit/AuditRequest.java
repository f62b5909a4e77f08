package dev.seocrawl.audit;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Input of an indexability audit.
 *
 * @param urls URLs to audit, 1 to {@value #MAX_URLS}
 * @param userAgent user agent override; the configured default otherwise
 */
public record AuditRequest(
    @NotEmpty @Size(max = MAX_URLS) List<@NotBlank String> urls, @Nullable String userAgent) {

  public static final int MAX_URLS = 200;

  public AuditRequest {
    if (urls == null || urls.isEmpty()) {
      throw new IllegalArgumentException("urls must not be empty");
    }
    if (urls.size() > MAX_URLS) {
      throw new IllegalArgumentException("urls must contain at most " + MAX_URLS + " entries");
    }
    urls = List.copyOf(urls);
  }

  public static AuditRequest of(String... urls) {
    return new AuditRequest(List.of(urls), null);
  }
}
