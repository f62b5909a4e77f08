package dev.seocrawl.fetch;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;

/** Parses fetched HTML bodies with jsoup, using the final URL as base for relative links. */
public final class HtmlDocuments {

  private HtmlDocuments() {
    // utility class
  }

  /**
   * Parse the body of {@code result}. The declared charset wins; otherwise jsoup sniffs the
   * {@code <meta charset>} and falls back to UTF-8.
   */
  public static Document parse(FetchResult result) {
    Charset charset = result.declaredCharset();
    try {
      return Jsoup.parse(
          new ByteArrayInputStream(result.body()),
          charset != null ? charset.name() : null,
          result.finalUrl());
    } catch (IOException e) {
      // in-memory stream
      throw new UncheckedIOException(e);
    }
  }
}
