package dev.seocrawl.audit;

/**
 * One {@code <link rel="alternate" hreflang>} entry.
 *
 * @param lang language or region code as written, e.g. {@code es-GT} or {@code x-default}
 * @param href absolute alternate URL
 */
public record HreflangLink(String lang, String href) {}
