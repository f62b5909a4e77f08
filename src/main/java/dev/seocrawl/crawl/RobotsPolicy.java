package dev.seocrawl.crawl;

import crawlercommons.robots.BaseRobotRules;
import crawlercommons.robots.SimpleRobotRules;
import crawlercommons.robots.SimpleRobotRules.RobotRulesMode;
import java.time.Duration;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Robots.txt rules for one origin and one user agent, as parsed by crawler-commons. The allow-all
 * policy stands in whenever robots handling is disabled or the file could not be obtained.
 */
public final class RobotsPolicy {

  private static final RobotsPolicy ALLOW_ALL =
      new RobotsPolicy(new SimpleRobotRules(RobotRulesMode.ALLOW_ALL));

  private final BaseRobotRules rules;

  private RobotsPolicy(BaseRobotRules rules) {
    this.rules = rules;
  }

  public static RobotsPolicy allowAll() {
    return ALLOW_ALL;
  }

  static RobotsPolicy of(BaseRobotRules rules) {
    return new RobotsPolicy(rules);
  }

  public boolean isAllowed(String url) {
    return rules.isAllowed(url);
  }

  /** Crawl-delay for the matched group, or null when none is declared. */
  public @Nullable Duration crawlDelay() {
    long delayMs = rules.getCrawlDelay();
    if (delayMs == BaseRobotRules.UNSET_CRAWL_DELAY || delayMs <= 0) {
      return null;
    }
    return Duration.ofMillis(delayMs);
  }

  /** Sitemap URLs declared in the file, in declaration order. */
  public List<String> sitemaps() {
    return List.copyOf(rules.getSitemaps());
  }
}
