package dev.seocrawl.fetch;

import dev.seocrawl.config.CrawlerProperties;
import dev.seocrawl.url.UrlCanonicalizer;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Performs one logical GET with manual redirect handling and a browser user-agent fallback.
 *
 * <p>Redirects (301, 302, 303, 307, 308) are followed up to {@value #MAX_REDIRECTS} hops, each
 * {@code Location} resolved against the current URL. A redirect without a location, or one past
 * the hop cap, ends the chain and that response is treated as final.
 *
 * <p>Fallback policy: when the final status is a typical WAF block (403, 406, 409, 410, 429, 451,
 * 503) the whole chain is retried with the fallback browser user agent; if that retry throws, the
 * blocked result is returned. When the first attempt throws, one retry with the fallback user
 * agent is made unless the caller already used it.
 */
@Component
public class RedirectFetcher {

  private static final Logger log = LoggerFactory.getLogger(RedirectFetcher.class);

  static final int MAX_REDIRECTS = 10;

  static final Set<Integer> REDIRECT_STATUSES = Set.of(301, 302, 303, 307, 308);

  static final Set<Integer> BLOCKED_STATUSES = Set.of(403, 406, 409, 410, 429, 451, 503);

  static final String ACCEPT =
      "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

  static final String ACCEPT_LANGUAGE = "en-US,en;q=0.9,es;q=0.8";

  private final RestClient restClient;
  private final String fallbackUserAgent;
  private final int maxBodyBytes;

  public RedirectFetcher(
      @Qualifier("crawlerRestClient") RestClient restClient, CrawlerProperties props) {
    this.restClient = restClient;
    this.fallbackUserAgent = props.fallbackUserAgent();
    this.maxBodyBytes = (int) Math.min(props.maxBodyBytes(), Integer.MAX_VALUE - 8);
  }

  /**
   * Fetch a URL following redirects, retrying with the fallback user agent when blocked.
   *
   * @param url absolute URL to fetch
   * @param userAgent user agent for the first attempt
   * @return the final response and redirect chain
   * @throws FetchException if the URL is malformed or unreachable after the fallback attempt
   */
  public FetchResult fetch(String url, String userAgent) throws FetchException {
    FetchResult first;
    try {
      first = fetchChain(url, userAgent);
    } catch (FetchException e) {
      if (fallbackUserAgent.equals(userAgent)) {
        throw e;
      }
      log.debug("Fetch of {} failed ({}), retrying with fallback user agent", url, e.getMessage());
      return fetchChain(url, fallbackUserAgent);
    }

    if (BLOCKED_STATUSES.contains(first.status()) && !fallbackUserAgent.equals(userAgent)) {
      log.debug("{} answered {}, retrying with fallback user agent", url, first.status());
      try {
        return fetchChain(url, fallbackUserAgent);
      } catch (FetchException e) {
        log.debug("Fallback fetch of {} failed, keeping blocked result: {}", url, e.getMessage());
        return first;
      }
    }
    return first;
  }

  public String fallbackUserAgent() {
    return fallbackUserAgent;
  }

  /** Follow redirects for a single user agent, without any fallback. */
  FetchResult fetchChain(String url, String userAgent) throws FetchException {
    List<RedirectHop> hops = new ArrayList<>();
    String current = url;
    RawResponse response = execute(current, userAgent);

    while (REDIRECT_STATUSES.contains(response.status()) && hops.size() < MAX_REDIRECTS) {
      String location = response.headers().getFirst(HttpHeaders.LOCATION);
      if (location == null || location.isBlank()) {
        break;
      }
      String next = UrlCanonicalizer.resolve(current, location);
      if (next == null) {
        log.debug("Unresolvable Location '{}' from {}", location, current);
        break;
      }
      hops.add(new RedirectHop(current, next, response.status()));
      current = next;
      response = execute(current, userAgent);
    }

    if (REDIRECT_STATUSES.contains(response.status()) && hops.size() >= MAX_REDIRECTS) {
      log.warn(
          "Redirect cap of {} hops reached for {}, stopping at {}", MAX_REDIRECTS, url, current);
    }

    return new FetchResult(
        url, current, response.status(), response.headers(), response.body(), hops);
  }

  private RawResponse execute(String url, String userAgent) throws FetchException {
    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      throw new FetchException("Malformed URL: " + url, e);
    }
    if (!uri.isAbsolute() || uri.getHost() == null) {
      throw new FetchException("Not an absolute URL: " + url);
    }

    try {
      RawResponse response =
          restClient
              .get()
              .uri(uri)
              .header(HttpHeaders.USER_AGENT, userAgent)
              .header(HttpHeaders.ACCEPT, ACCEPT)
              .header(HttpHeaders.ACCEPT_LANGUAGE, ACCEPT_LANGUAGE)
              .exchange((request, clientResponse) -> read(url, clientResponse));
      if (response == null) {
        throw new FetchException("No response for " + url);
      }
      return response;
    } catch (RestClientException | IllegalArgumentException e) {
      throw new FetchException("Fetch failed for " + url + ": " + e.getMessage(), e);
    }
  }

  private RawResponse read(String url, ClientHttpResponse response) throws IOException {
    int status = response.getStatusCode().value();
    HttpHeaders headers = new HttpHeaders();
    headers.putAll(response.getHeaders());
    if (REDIRECT_STATUSES.contains(status)) {
      return new RawResponse(status, headers, new byte[0]);
    }
    try (InputStream in = response.getBody()) {
      byte[] body = in.readNBytes(maxBodyBytes);
      if (body.length == maxBodyBytes && in.read() != -1) {
        log.warn("Body of {} exceeds {} bytes, truncated", url, maxBodyBytes);
      }
      return new RawResponse(status, headers, body);
    }
  }

  private record RawResponse(int status, HttpHeaders headers, byte[] body) {}
}
