package dev.seocrawl.url;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Static utility that turns URLs into stable deduplication keys and answers the "same site?"
 * question used by the crawler and the auditor.
 *
 * <p>The eTLD+1 used here is the last two dot-separated labels of the host. Multi-label public
 * suffixes such as {@code co.uk} are not recognised.
 */
public final class UrlCanonicalizer {

  private static final Logger log = LoggerFactory.getLogger(UrlCanonicalizer.class);

  private static final Set<String> TRACKING_PARAMS =
      Set.of("gclid", "fbclid", "igshid", "mc_cid", "mc_eid");

  private static final String UTM_PREFIX = "utm_";

  private static final Pattern DIRECTORY_INDEX = Pattern.compile("^index\\.[a-z]+$");

  private static final String WWW = "www.";

  private static final String PATH_CHARS = "-._~!$&'()*+,;=:@/";

  private static final String QUERY_CHARS = PATH_CHARS + "?";

  private static final char[] HEX = "0123456789ABCDEF".toCharArray();

  private UrlCanonicalizer() {
    // utility class
  }

  /**
   * Normalize a URL into its deduplication key:
   *
   * <ul>
   *   <li>lower-case scheme and host, drop default ports
   *   <li>remove the fragment
   *   <li>drop tracking parameters ({@code utm_*}, gclid, fbclid, igshid, mc_cid, mc_eid)
   *   <li>drop a trailing {@code index.*} directory index and trailing slashes (root keeps "/")
   *   <li>sort the remaining query parameters by name
   * </ul>
   *
   * <p>A leading {@code www.} is kept and the scheme is never switched. Applying the method to its
   * own output returns the same string.
   *
   * @param url the URL to normalize
   * @return the normalized key, or the input unchanged if it is not an absolute URL
   */
  public static String normalizeForKey(String url) {
    if (url == null || url.isBlank()) {
      return url;
    }

    URI uri;
    try {
      uri = new URI(url);
    } catch (URISyntaxException e) {
      log.debug("Malformed URL, keeping as key: {}", url);
      return url;
    }
    if (uri.getScheme() == null || uri.getHost() == null) {
      return url;
    }

    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    String host = uri.getHost().toLowerCase(Locale.ROOT);
    int port = uri.getPort();

    StringBuilder sb = new StringBuilder();
    sb.append(scheme).append("://");
    if (uri.getRawUserInfo() != null) {
      sb.append(uri.getRawUserInfo()).append('@');
    }
    sb.append(host);
    if (port != -1 && !isDefaultPort(scheme, port)) {
      sb.append(':').append(port);
    }
    sb.append(normalizePath(uri.getRawPath()));

    String query = filterAndSortQuery(uri.getRawQuery());
    if (query != null) {
      sb.append('?').append(query);
    }
    return sb.toString();
  }

  /**
   * Check whether {@code target} belongs to the same site as {@code base}. Both must share the
   * naive eTLD+1; unless {@code includeSubdomains} is set, the hostnames must also be equal.
   */
  public static boolean isInternal(URI base, URI target, boolean includeSubdomains) {
    String baseHost = lowerHost(base);
    String targetHost = lowerHost(target);
    if (baseHost == null || targetHost == null) {
      return false;
    }
    if (!etldPlusOne(baseHost).equals(etldPlusOne(targetHost))) {
      return false;
    }
    return includeSubdomains || baseHost.equals(targetHost);
  }

  /** String variant of {@link #isInternal(URI, URI, boolean)}; unparseable input is external. */
  public static boolean isInternal(String base, String target, boolean includeSubdomains) {
    URI baseUri = parse(base);
    URI targetUri = parse(target);
    return baseUri != null
        && targetUri != null
        && isInternal(baseUri, targetUri, includeSubdomains);
  }

  /** True when both URLs share the naive eTLD+1 (last two host labels). */
  public static boolean sameEtldPlusOne(URI a, URI b) {
    String aHost = lowerHost(a);
    String bHost = lowerHost(b);
    return aHost != null && bHost != null && etldPlusOne(aHost).equals(etldPlusOne(bHost));
  }

  /**
   * Naive eTLD+1: the last two dot-separated labels of the host.
   *
   * @param host a hostname, any case
   * @return the lower-cased last two labels, or the whole host if it has fewer
   */
  public static String etldPlusOne(String host) {
    String[] labels = host.toLowerCase(Locale.ROOT).split("\\.");
    if (labels.length <= 2) {
      return String.join(".", labels);
    }
    return labels[labels.length - 2] + "." + labels[labels.length - 1];
  }

  /**
   * Resolve an href against a base URL the way a browser would. Characters a URI may not carry
   * (spaces, {@code |}, non-ASCII) are percent-encoded as UTF-8 in the path, query and fragment;
   * existing {@code %XX} escapes are kept.
   *
   * @return the absolute URL, or null if either side cannot be parsed
   */
  public static @Nullable String resolve(String base, String href) {
    URL url;
    try {
      url = new URL(new URL(base), href.trim());
    } catch (MalformedURLException | IllegalArgumentException e) {
      return null;
    }
    StringBuilder sb = new StringBuilder(url.getProtocol()).append(':');
    if (url.getAuthority() != null) {
      sb.append("//").append(url.getAuthority());
    }
    sb.append(percentEncode(url.getPath(), PATH_CHARS));
    if (url.getQuery() != null) {
      sb.append('?').append(percentEncode(url.getQuery(), QUERY_CHARS));
    }
    if (url.getRef() != null) {
      sb.append('#').append(percentEncode(url.getRef(), QUERY_CHARS));
    }
    String resolved = sb.toString();
    return parse(resolved) == null ? null : resolved;
  }

  /**
   * Return the same URL on the www/non-www counterpart host: {@code example.com} becomes {@code
   * www.example.com} and vice versa.
   *
   * @return the counterpart URL, or null if the URL has no parseable host
   */
  public static @Nullable String wwwCounterpart(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getHost() == null) {
      return null;
    }
    String host = uri.getHost();
    String counterpart =
        host.toLowerCase(Locale.ROOT).startsWith(WWW) ? host.substring(WWW.length()) : WWW + host;
    try {
      return new URI(
              uri.getScheme(),
              uri.getRawUserInfo(),
              counterpart,
              uri.getPort(),
              uri.getPath(),
              uri.getQuery(),
              uri.getFragment())
          .toString();
    } catch (URISyntaxException e) {
      return null;
    }
  }

  /** Scheme + authority of an absolute URL, e.g. {@code https://example.com:8443}. */
  public static @Nullable String origin(String url) {
    URI uri = parse(url);
    if (uri == null || uri.getScheme() == null || uri.getRawAuthority() == null) {
      return null;
    }
    return uri.getScheme().toLowerCase(Locale.ROOT) + "://" + uri.getRawAuthority();
  }

  /** True for absolute http(s) URLs with a host. */
  public static boolean isHttpUrl(@Nullable String url) {
    URI uri = url == null ? null : parse(url);
    if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
      return false;
    }
    String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
    return scheme.equals("http") || scheme.equals("https");
  }

  /** Parse to a {@link URI}, returning null instead of throwing. */
  public static @Nullable URI parse(@Nullable String url) {
    if (url == null) {
      return null;
    }
    try {
      return new URI(url.trim());
    } catch (URISyntaxException e) {
      return null;
    }
  }

  private static String percentEncode(String component, String allowed) {
    StringBuilder sb = new StringBuilder(component.length());
    byte[] bytes = component.getBytes(StandardCharsets.UTF_8);
    for (int i = 0; i < bytes.length; i++) {
      int b = bytes[i] & 0xFF;
      if (isAsciiAlphanumeric(b) || (b < 0x80 && allowed.indexOf(b) >= 0)) {
        sb.append((char) b);
      } else if (b == '%' && i + 2 < bytes.length && isHex(bytes[i + 1]) && isHex(bytes[i + 2])) {
        sb.append('%');
      } else {
        sb.append('%').append(HEX[b >> 4]).append(HEX[b & 0x0F]);
      }
    }
    return sb.toString();
  }

  private static boolean isAsciiAlphanumeric(int b) {
    return (b >= 'a' && b <= 'z') || (b >= 'A' && b <= 'Z') || (b >= '0' && b <= '9');
  }

  private static boolean isHex(byte b) {
    return isAsciiAlphanumeric(b) && Character.digit(b, 16) >= 0;
  }

  private static String normalizePath(@Nullable String rawPath) {
    String path = rawPath == null || rawPath.isEmpty() ? "/" : rawPath;
    String previous;
    do {
      previous = path;
      path = stripTrailingSlashes(removeDirectoryIndex(path));
    } while (!path.equals(previous));
    return path;
  }

  private static String removeDirectoryIndex(String path) {
    int slash = path.lastIndexOf('/');
    String last = path.substring(slash + 1);
    if (DIRECTORY_INDEX.matcher(last).matches()) {
      return path.substring(0, slash + 1);
    }
    return path;
  }

  private static String stripTrailingSlashes(String path) {
    int end = path.length();
    while (end > 1 && path.charAt(end - 1) == '/') {
      end--;
    }
    return path.substring(0, end);
  }

  private static @Nullable String filterAndSortQuery(@Nullable String query) {
    if (query == null || query.isEmpty()) {
      return null;
    }
    List<String> kept = new ArrayList<>();
    for (String param : query.split("&")) {
      if (param.isEmpty()) {
        continue;
      }
      String key = paramName(param);
      if (key.startsWith(UTM_PREFIX) || TRACKING_PARAMS.contains(key)) {
        continue;
      }
      kept.add(param);
    }
    if (kept.isEmpty()) {
      return null;
    }
    kept.sort(Comparator.comparing(UrlCanonicalizer::paramName));
    return String.join("&", kept);
  }

  private static String paramName(String param) {
    int eq = param.indexOf('=');
    return eq < 0 ? param : param.substring(0, eq);
  }

  private static @Nullable String lowerHost(URI uri) {
    return uri.getHost() == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
  }

  private static boolean isDefaultPort(String scheme, int port) {
    return ("http".equals(scheme) && port == 80) || ("https".equals(scheme) && port == 443);
  }
}
