package dev.seocrawl.audit;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;

/**
 * Set of robots directives explicitly asserted by a meta tag or header. An absent signal is
 * represented by {@code null}, never by an empty set: an empty set means the signal was present
 * but asserted nothing we recognise (for example {@code "all"} or {@code "max-snippet:-1"}).
 */
public record RobotsDirectives(Set<RobotsDirective> asserted) {

  private static final Pattern SEPARATORS = Pattern.compile("[,;]+");

  public RobotsDirectives {
    asserted =
        asserted == null || asserted.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(RobotsDirective.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(asserted));
  }

  public static RobotsDirectives of(RobotsDirective... directives) {
    Set<RobotsDirective> set = EnumSet.noneOf(RobotsDirective.class);
    Collections.addAll(set, directives);
    return new RobotsDirectives(set);
  }

  /**
   * Parse a meta content or header value. Tokens are split on commas and semicolons and matched
   * case-insensitively; unknown tokens are ignored.
   *
   * @return the asserted directives, or null for a null or blank value
   */
  public static @Nullable RobotsDirectives parse(@Nullable String raw) {
    if (raw == null || raw.isBlank()) {
      return null;
    }
    Set<RobotsDirective> found = EnumSet.noneOf(RobotsDirective.class);
    for (String token : SEPARATORS.split(raw)) {
      if (!token.isBlank()) {
        RobotsDirective.fromToken(token).ifPresent(found::add);
      }
    }
    return new RobotsDirectives(found);
  }

  /** Per-directive OR. Null only when both sides are null. */
  public static @Nullable RobotsDirectives merge(
      @Nullable RobotsDirectives a, @Nullable RobotsDirectives b) {
    if (a == null) {
      return b;
    }
    if (b == null) {
      return a;
    }
    Set<RobotsDirective> union = EnumSet.noneOf(RobotsDirective.class);
    union.addAll(a.asserted());
    union.addAll(b.asserted());
    return new RobotsDirectives(union);
  }

  public boolean has(RobotsDirective directive) {
    return asserted.contains(directive);
  }

  public boolean noindex() {
    return has(RobotsDirective.NOINDEX);
  }

  /** JSON form: only asserted keys, each mapped to {@code true}. */
  @JsonValue
  public Map<String, Boolean> toJson() {
    Map<String, Boolean> json = new LinkedHashMap<>();
    for (RobotsDirective directive : asserted) {
      json.put(directive.token(), Boolean.TRUE);
    }
    return json;
  }
}
