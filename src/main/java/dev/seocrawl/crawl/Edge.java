package dev.seocrawl.crawl;

/**
 * One observed internal link.
 *
 * @param from normalized key of the page containing the anchor
 * @param to normalized key of the anchor's resolved target
 */
public record Edge(String from, String to) {}
