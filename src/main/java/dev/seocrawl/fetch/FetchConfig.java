package dev.seocrawl.fetch;

import dev.seocrawl.config.CrawlerProperties;
import java.net.http.HttpClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient} used for every crawl, robots, sitemap and audit request.
 *
 * <p>Redirects are disabled at the transport so {@link RedirectFetcher} can record each hop.
 * Timeouts come from {@code seocrawl.crawler.*}. The client is qualified as {@code
 * "crawlerRestClient"}.
 */
@Configuration
public class FetchConfig {

  @Bean
  public RestClient crawlerRestClient(RestClient.Builder builder, CrawlerProperties props) {
    HttpClient httpClient =
        HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(props.connectTimeout())
            .build();

    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(props.requestTimeout());

    return builder.requestFactory(requestFactory).build();
  }
}
