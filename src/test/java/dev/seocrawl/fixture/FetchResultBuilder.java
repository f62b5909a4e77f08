package dev.seocrawl.fixture;

import dev.seocrawl.fetch.FetchResult;
import dev.seocrawl.fetch.RedirectHop;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.springframework.http.HttpHeaders;

/** Builds {@link FetchResult} instances for tests that mock the fetcher. */
public final class FetchResultBuilder {

  private final String requestedUrl;
  private String finalUrl;
  private int status = 200;
  private final HttpHeaders headers = new HttpHeaders();
  private byte[] body = new byte[0];
  private final List<RedirectHop> redirectChain = new ArrayList<>();

  private FetchResultBuilder(String url) {
    this.requestedUrl = url;
    this.finalUrl = url;
  }

  public static FetchResultBuilder fetched(String url) {
    return new FetchResultBuilder(url);
  }

  /** 200 text/html page with the given markup. */
  public static FetchResult htmlPage(String url, String html) {
    return fetched(url).html(html).build();
  }

  public FetchResultBuilder status(int status) {
    this.status = status;
    return this;
  }

  public FetchResultBuilder html(String html) {
    headers.set(HttpHeaders.CONTENT_TYPE, "text/html; charset=utf-8");
    this.body = html.getBytes(StandardCharsets.UTF_8);
    return this;
  }

  public FetchResultBuilder body(String contentType, String content) {
    headers.set(HttpHeaders.CONTENT_TYPE, contentType);
    this.body = content.getBytes(StandardCharsets.UTF_8);
    return this;
  }

  public FetchResultBuilder header(String name, String value) {
    headers.add(name, value);
    return this;
  }

  public FetchResultBuilder redirectedTo(String target, int hopStatus) {
    redirectChain.add(new RedirectHop(finalUrl, target, hopStatus));
    this.finalUrl = target;
    return this;
  }

  public FetchResult build() {
    return new FetchResult(requestedUrl, finalUrl, status, headers, body, redirectChain);
  }
}
