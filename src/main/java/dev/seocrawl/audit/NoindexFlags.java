package dev.seocrawl.audit;

/**
 * Noindex as seen by each signal source separately.
 *
 * @param meta a meta robots tag asserts noindex
 * @param header an {@code X-Robots-Tag} header asserts noindex
 */
public record NoindexFlags(boolean meta, boolean header) {

  public static final NoindexFlags NONE = new NoindexFlags(false, false);

  /**
   * The two flags disagree, so one of them says noindex. An absent source counts as not asserting
   * noindex, so a lone meta noindex conflicts with a silent header.
   */
  public boolean conflicting() {
    return meta != header;
  }
}
