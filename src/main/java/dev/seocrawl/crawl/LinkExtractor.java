package dev.seocrawl.crawl;

import dev.seocrawl.fetch.FetchResult;
import dev.seocrawl.fetch.HtmlDocuments;
import dev.seocrawl.url.UrlCanonicalizer;
import java.util.LinkedHashSet;
import java.util.Set;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

/** Extracts absolute http(s) anchor targets from an HTML page. */
final class LinkExtractor {

  private LinkExtractor() {
    // utility class
  }

  /**
   * Resolve every {@code <a href>} against the page's final URL. Empty hrefs and non-http schemes
   * ({@code mailto:}, {@code javascript:}) are dropped. Order follows the document; duplicates
   * are collapsed on the resolved string.
   */
  static Set<String> extract(FetchResult page) {
    Document document = HtmlDocuments.parse(page);
    Set<String> links = new LinkedHashSet<>();
    for (Element anchor : document.select("a[href]")) {
      String href = anchor.attr("href").trim();
      if (href.isEmpty()) {
        continue;
      }
      String absolute = UrlCanonicalizer.resolve(page.finalUrl(), href);
      if (UrlCanonicalizer.isHttpUrl(absolute)) {
        links.add(absolute);
      }
    }
    return links;
  }
}
