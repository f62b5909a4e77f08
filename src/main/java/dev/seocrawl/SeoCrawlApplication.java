package dev.seocrawl;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point for the SEO crawler.
 *
 * <p>Supports two Spring profiles: {@code web} (REST + MCP over HTTP on port 8787) and {@code
 * stdio} (MCP stdio transport, no web server).
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class SeoCrawlApplication {
  public static void main(String[] args) {
    SpringApplication.run(SeoCrawlApplication.class, args);
  }
}
