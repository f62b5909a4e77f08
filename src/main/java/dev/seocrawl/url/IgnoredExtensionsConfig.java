package dev.seocrawl.url;

import dev.seocrawl.config.CrawlerProperties;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;

/**
 * Loads the ignored-extension list once at startup.
 *
 * <p>Resolution order: the file named by {@code seocrawl.crawler.ignore-extensions-file} if it
 * exists, then the bundled {@code ignore-extensions.txt} classpath asset. When neither is
 * available the list is empty and nothing is ignored.
 */
@Configuration
public class IgnoredExtensionsConfig {

  private static final Logger log = LoggerFactory.getLogger(IgnoredExtensionsConfig.class);

  static final String BUNDLED_ASSET = "ignore-extensions.txt";

  @Bean
  public IgnoredExtensions ignoredExtensions(CrawlerProperties props) {
    IgnoredExtensions loaded = load(props.ignoreExtensionsFile());
    log.info("Loaded {} ignored extensions", loaded.size());
    return loaded;
  }

  static IgnoredExtensions load(@Nullable String overridePath) {
    if (overridePath != null && !overridePath.isBlank()) {
      Path path = Path.of(overridePath);
      if (Files.isRegularFile(path)) {
        try {
          return IgnoredExtensions.parse(Files.readString(path, StandardCharsets.UTF_8));
        } catch (IOException e) {
          log.warn("Could not read ignore list {}: {}", path, e.getMessage());
        }
      } else {
        log.warn("Ignore list override {} not found, using bundled asset", path);
      }
    }

    ClassPathResource asset = new ClassPathResource(BUNDLED_ASSET);
    if (!asset.exists()) {
      return IgnoredExtensions.none();
    }
    try (InputStream in = asset.getInputStream()) {
      return IgnoredExtensions.parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
    } catch (IOException e) {
      log.warn("Could not read bundled ignore list: {}", e.getMessage());
      return IgnoredExtensions.none();
    }
  }
}
