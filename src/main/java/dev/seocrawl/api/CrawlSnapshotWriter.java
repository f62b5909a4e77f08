package dev.seocrawl.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.seocrawl.crawl.CrawlRequest;
import dev.seocrawl.crawl.CrawlResult;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Persists each REST crawl as a JSON snapshot ({@code {"input": ..., "output": ...}}) named after
 * the crawled host and the current time, so runs can be diffed later.
 */
@Component
public class CrawlSnapshotWriter {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSS");

  private final Path outputDir;
  private final boolean enabled;
  private final Clock clock;
  private final ObjectMapper objectMapper;

  public CrawlSnapshotWriter(
      @Value("${seocrawl.snapshot.dir:./data/snapshots}") String outputDir,
      @Value("${seocrawl.snapshot.enabled:true}") boolean enabled,
      Clock clock,
      ObjectMapper objectMapper) {
    this.outputDir = Path.of(outputDir);
    this.enabled = enabled;
    this.clock = clock;
    this.objectMapper = objectMapper;
  }

  public boolean enabled() {
    return enabled;
  }

  /**
   * Write the snapshot of one crawl.
   *
   * @return absolute path of the written file
   * @throws IOException if the directory or file cannot be written
   */
  public Path write(CrawlRequest input, CrawlResult output) throws IOException {
    Files.createDirectories(outputDir);
    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    Path file = outputDir.resolve("%s-%s.json".formatted(hostSlug(input.startUrl()), timestamp));

    Map<String, Object> snapshot = new LinkedHashMap<>();
    snapshot.put("input", input);
    snapshot.put("output", output);
    objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), snapshot);
    return file.toAbsolutePath();
  }

  static String hostSlug(String startUrl) {
    URI uri;
    try {
      uri = URI.create(startUrl.trim());
    } catch (IllegalArgumentException e) {
      return "unknown";
    }
    String authority = uri.getRawAuthority();
    return authority == null ? "unknown" : authority.replaceAll("[:/\\\\]", "_");
  }
}
