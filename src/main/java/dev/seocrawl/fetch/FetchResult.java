package dev.seocrawl.fetch;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import org.jspecify.annotations.Nullable;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

/**
 * Outcome of one logical fetch: the final response after redirects plus the hops taken to reach
 * it.
 *
 * @param requestedUrl URL originally asked for
 * @param finalUrl URL of the response that ended the chain
 * @param status HTTP status of the final response
 * @param headers headers of the final response (case-insensitive)
 * @param body body of the final response, possibly truncated; empty for redirects. Copied on the
 *     way in and out, and compared by content
 * @param redirectChain hops followed, in order; empty when the first response was final
 */
public record FetchResult(
    String requestedUrl,
    String finalUrl,
    int status,
    HttpHeaders headers,
    byte[] body,
    List<RedirectHop> redirectChain) {

  public FetchResult {
    redirectChain = redirectChain == null ? List.of() : List.copyOf(redirectChain);
    body = body == null ? new byte[0] : body.clone();
    headers = headers == null ? new HttpHeaders() : headers;
  }

  @Override
  public byte[] body() {
    return body.clone();
  }

  /** Raw {@code Content-Type} header value, or null when absent. */
  public @Nullable String contentType() {
    return headers.getFirst(HttpHeaders.CONTENT_TYPE);
  }

  /** Every value of a header, in order; a repeated header yields several entries. */
  public List<String> headerValues(String name) {
    List<String> values = headers.get(name);
    return values == null ? List.of() : List.copyOf(values);
  }

  /** 2xx status. */
  public boolean isSuccessful() {
    return status >= 200 && status < 300;
  }

  /** Content type mentions {@code text/html}. */
  public boolean isHtml() {
    String contentType = contentType();
    return contentType != null && contentType.toLowerCase(Locale.ROOT).contains("text/html");
  }

  /** Charset declared in the content type, or null to let the parser sniff it. */
  public @Nullable Charset declaredCharset() {
    String contentType = contentType();
    if (contentType == null) {
      return null;
    }
    try {
      return MediaType.parseMediaType(contentType).getCharset();
    } catch (IllegalArgumentException e) {
      return null;
    }
  }

  /** Body decoded with the declared charset, falling back to UTF-8. */
  public String bodyAsString() {
    Charset charset = declaredCharset();
    return new String(body, charset != null ? charset : StandardCharsets.UTF_8);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof FetchResult other)) {
      return false;
    }
    return status == other.status
        && Objects.equals(requestedUrl, other.requestedUrl)
        && Objects.equals(finalUrl, other.finalUrl)
        && headers.equals(other.headers)
        && Arrays.equals(body, other.body)
        && redirectChain.equals(other.redirectChain);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(requestedUrl, finalUrl, status, headers, redirectChain);
    return 31 * result + Arrays.hashCode(body);
  }

  @Override
  public String toString() {
    return "FetchResult[requestedUrl=%s, finalUrl=%s, status=%d, body=%d bytes, redirectChain=%s]"
        .formatted(requestedUrl, finalUrl, status, body.length, redirectChain);
  }
}
