package dev.seocrawl.audit;

import dev.seocrawl.url.UrlCanonicalizer;
import java.util.ArrayList;
import java.util.List;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.jspecify.annotations.Nullable;

/**
 * Indexability signals found in an HTML document.
 *
 * @param canonical first canonical, resolved against the page URL; null if absent or unresolvable
 * @param canonicalInvalid a canonical href was present but could not be resolved to an http(s) URL
 * @param canonicalCount number of {@code <link rel="canonical">} elements
 * @param hreflang alternates in document order
 * @param metaRobots merged content of every {@code <meta name="robots">}; null if none
 */
record HtmlSignals(
    @Nullable String canonical,
    boolean canonicalInvalid,
    int canonicalCount,
    List<HreflangLink> hreflang,
    @Nullable RobotsDirectives metaRobots) {

  static final HtmlSignals NONE = new HtmlSignals(null, false, 0, List.of(), null);

  static HtmlSignals extract(Document document, String pageUrl) {
    Elements canonicals = document.select("link[rel=canonical]");
    String canonical = null;
    boolean canonicalInvalid = false;
    if (!canonicals.isEmpty()) {
      String href = canonicals.first().attr("href").trim();
      if (!href.isEmpty()) {
        canonical = UrlCanonicalizer.resolve(pageUrl, href);
        if (!UrlCanonicalizer.isHttpUrl(canonical)) {
          canonical = null;
          canonicalInvalid = true;
        }
      }
    }

    List<HreflangLink> hreflang = new ArrayList<>();
    for (Element link : document.select("link[rel=alternate][hreflang]")) {
      String lang = link.attr("hreflang").trim();
      String href = link.attr("href").trim();
      if (lang.isEmpty() || href.isEmpty()) {
        continue;
      }
      String absolute = UrlCanonicalizer.resolve(pageUrl, href);
      if (absolute != null) {
        hreflang.add(new HreflangLink(lang, absolute));
      }
    }

    RobotsDirectives metaRobots = null;
    for (Element meta : document.select("meta[name=robots]")) {
      RobotsDirectives parsed = RobotsDirectives.parse(meta.attr("content"));
      metaRobots = RobotsDirectives.merge(metaRobots, parsed);
    }

    return new HtmlSignals(canonical, canonicalInvalid, canonicals.size(), hreflang, metaRobots);
  }
}
