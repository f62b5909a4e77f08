package dev.seocrawl.url;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class IgnoredExtensionsConfigTest {

  @TempDir Path tempDir;

  @Test
  void loadsBundledAssetByDefault() {
    IgnoredExtensions ignored = IgnoredExtensionsConfig.load(null);

    assertThat(ignored.size()).isPositive();
    assertThat(ignored.matches("https://example.com/brochure.pdf")).isTrue();
    assertThat(ignored.matches("https://example.com/release.tar.gz")).isTrue();
    assertThat(ignored.matches("https://example.com/about")).isFalse();
  }

  @Test
  void overrideFileReplacesBundledAsset() throws IOException {
    Path override = tempDir.resolve("ignore.txt");
    Files.writeString(override, "xml\n");

    IgnoredExtensions ignored = IgnoredExtensionsConfig.load(override.toString());

    assertThat(ignored.size()).isEqualTo(1);
    assertThat(ignored.matches("https://example.com/feed.xml")).isTrue();
    assertThat(ignored.matches("https://example.com/brochure.pdf")).isFalse();
  }

  @Test
  void missingOverrideFallsBackToBundledAsset() {
    IgnoredExtensions ignored =
        IgnoredExtensionsConfig.load(tempDir.resolve("absent.txt").toString());

    assertThat(ignored.matches("https://example.com/brochure.pdf")).isTrue();
  }

  @Test
  void blankOverrideIsIgnored() {
    assertThat(IgnoredExtensionsConfig.load("  ").size())
        .isEqualTo(IgnoredExtensionsConfig.load(null).size());
  }
}
