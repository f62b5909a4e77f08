package dev.seocrawl.url;

import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/**
 * Immutable list of file extensions the crawler never follows (binaries, media, archives).
 *
 * <p>Entries are lower-cased and may be written with or without a leading dot. Compound archive
 * suffixes ({@code tar.gz}, {@code tar.bz2}, {@code tar.xz}) only match when listed in that exact
 * compound form. Loaded once at startup by {@link IgnoredExtensionsConfig} and injected.
 */
public final class IgnoredExtensions {

  private static final List<String> COMPOUND_SUFFIXES = List.of("tar.gz", "tar.bz2", "tar.xz");

  private final Set<String> extensions;

  private IgnoredExtensions(Set<String> extensions) {
    this.extensions = extensions;
  }

  /** An empty list: nothing is ignored. */
  public static IgnoredExtensions none() {
    return new IgnoredExtensions(Set.of());
  }

  /**
   * Build from raw entries, trimming and lower-casing each; blank entries are dropped.
   *
   * @param entries extension entries such as {@code "pdf"} or {@code ".zip"}
   */
  public static IgnoredExtensions of(Collection<String> entries) {
    return new IgnoredExtensions(
        entries.stream()
            .map(s -> s.trim().toLowerCase(Locale.ROOT))
            .filter(s -> !s.isEmpty())
            .collect(Collectors.toUnmodifiableSet()));
  }

  /** Parse a newline-delimited list. */
  public static IgnoredExtensions parse(String content) {
    return of(List.of(content.split("\\R")));
  }

  /**
   * Check whether the URL path ends in an ignored extension.
   *
   * @param url an absolute URL
   * @return true if the path's compound or final extension is listed
   */
  public boolean matches(URI url) {
    if (extensions.isEmpty() || url.getPath() == null) {
      return false;
    }
    String path = url.getPath().toLowerCase(Locale.ROOT);

    for (String compound : COMPOUND_SUFFIXES) {
      if (path.endsWith("." + compound) && extensions.contains(compound)) {
        return true;
      }
    }

    String ext = extension(path);
    if (ext == null) {
      return false;
    }
    return extensions.contains(ext) || extensions.contains("." + ext);
  }

  /** String variant of {@link #matches(URI)}; unparseable URLs never match. */
  public boolean matches(String url) {
    URI uri = UrlCanonicalizer.parse(url);
    return uri != null && matches(uri);
  }

  public int size() {
    return extensions.size();
  }

  /** Final extension of the last path segment without the dot; null when there is none. */
  private static @Nullable String extension(String path) {
    String name = path.substring(path.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return null;
    }
    return name.substring(dot + 1);
  }
}
