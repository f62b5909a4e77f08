package dev.seocrawl.audit;

import java.util.Locale;
import java.util.Optional;

/** The robots directives recognised in {@code <meta name="robots">} and {@code X-Robots-Tag}. */
public enum RobotsDirective {
  NOINDEX,
  NOFOLLOW,
  NOARCHIVE,
  NOSNIPPET,
  NOIMAGEINDEX,
  NOCACHE;

  /** Lower-case keyword as written in HTML and headers. */
  public String token() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Match a single, already trimmed token; anything unrecognised is empty. */
  public static Optional<RobotsDirective> fromToken(String token) {
    String normalized = token.trim().toLowerCase(Locale.ROOT);
    for (RobotsDirective directive : values()) {
      if (directive.token().equals(normalized)) {
        return Optional.of(directive);
      }
    }
    return Optional.empty();
  }
}
