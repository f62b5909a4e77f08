package dev.seocrawl.crawl;

import dev.seocrawl.fetch.FetchResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable traversal state of a single crawl run, shared by the worker threads. Every read and
 * write goes through this object's monitor.
 */
final class CrawlState {

  record Node(String url, int depth) {}

  private final int maxPages;
  private final Set<String> seen = new HashSet<>();
  private final Map<String, InventoryItem> inventory = new LinkedHashMap<>();
  private final List<Edge> edges = new ArrayList<>();
  private final Deque<Node> queue = new ArrayDeque<>();
  private int fetched;

  CrawlState(int maxPages) {
    this.maxPages = maxPages;
  }

  /** Mark a key as seen. Returns false if another visit already claimed it. */
  synchronized boolean markSeen(String key) {
    return seen.add(key);
  }

  synchronized void enqueue(String url, int depth) {
    queue.addLast(new Node(url, depth));
  }

  /** Enqueue unless the key was already visited. Queued duplicates are dropped at visit time. */
  synchronized void enqueueIfUnseen(String url, String key, int depth) {
    if (!seen.contains(key)) {
      queue.addLast(new Node(url, depth));
    }
  }

  /**
   * Put back a node that was claimed but found no fetch budget left. Its key is released and it
   * goes to the head of the queue, so a unit freed by a failed sibling fetch can still reach it.
   */
  synchronized void deferForBudget(Node node, String key) {
    seen.remove(key);
    queue.addFirst(node);
  }

  synchronized boolean hasQueued() {
    return !queue.isEmpty();
  }

  synchronized List<Node> nextBatch(int size) {
    List<Node> batch = new ArrayList<>(Math.min(size, queue.size()));
    while (batch.size() < size && !queue.isEmpty()) {
      batch.add(queue.pollFirst());
    }
    return batch;
  }

  /** Claim one unit of the fetch budget before going to the network. */
  synchronized boolean tryReserveFetch() {
    if (fetched >= maxPages) {
      return false;
    }
    fetched++;
    return true;
  }

  /** Give back a reserved unit after a failed fetch. */
  synchronized void releaseFetch() {
    fetched--;
  }

  synchronized int fetchedCount() {
    return fetched;
  }

  synchronized int remainingBudget() {
    return Math.max(0, maxPages - fetched);
  }

  /** Register a sitemap URL as an unfetched placeholder, or upgrade an existing entry. */
  synchronized void registerSitemapUrl(String key) {
    InventoryItem existing = inventory.get(key);
    if (existing == null) {
      inventory.put(key, InventoryItem.sitemapPlaceholder(key));
    } else {
      Discovery merged = existing.discoveredBy().merge(Discovery.SITEMAP);
      inventory.put(key, existing.withDiscoveredBy(merged));
    }
  }

  /** Store a visited item, keeping any provenance already known for its key. */
  synchronized void recordVisit(InventoryItem item) {
    InventoryItem previous = inventory.get(item.normalizedUrl());
    if (previous == null) {
      inventory.put(item.normalizedUrl(), item);
    } else {
      inventory.put(
          item.normalizedUrl(),
          item.withDiscoveredBy(previous.discoveredBy().merge(item.discoveredBy())));
    }
  }

  /** Replace a sitemap placeholder with the outcome of a post-pass fetch. */
  synchronized void resolvePlaceholder(String key, FetchResult result, int depthCap) {
    InventoryItem previous = inventory.get(key);
    if (previous == null) {
      return;
    }
    inventory.put(
        key,
        new InventoryItem(
            previous.url(),
            key,
            result.finalUrl(),
            result.status(),
            result.contentType(),
            Math.min(previous.depth(), depthCap),
            Discovery.BOTH,
            result.redirectChain()));
  }

  /** True when the key is a placeholder that has never been fetched. */
  synchronized boolean isUnfetched(String key) {
    InventoryItem item = inventory.get(key);
    return item != null && !item.fetched();
  }

  synchronized void addEdge(Edge edge) {
    edges.add(edge);
  }

  synchronized Set<String> inboundKeys() {
    Set<String> inbound = new LinkedHashSet<>();
    for (Edge edge : edges) {
      inbound.add(edge.to());
    }
    return inbound;
  }

  synchronized List<InventoryItem> inventory() {
    return List.copyOf(inventory.values());
  }

  synchronized List<Edge> edges() {
    return List.copyOf(edges);
  }
}
