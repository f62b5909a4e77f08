package dev.seocrawl.crawl;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collection;

/**
 * Histogram of final statuses by family. {@code 0xx} counts entries that were never fetched.
 * Statuses outside 1xx-5xx families other than 0 are not counted.
 */
public record StatusBuckets(
    @JsonProperty("0xx") int unfetched,
    @JsonProperty("2xx") int success,
    @JsonProperty("3xx") int redirect,
    @JsonProperty("4xx") int clientError,
    @JsonProperty("5xx") int serverError) {

  public static StatusBuckets of(Collection<InventoryItem> inventory) {
    int unfetched = 0;
    int success = 0;
    int redirect = 0;
    int clientError = 0;
    int serverError = 0;
    for (InventoryItem item : inventory) {
      int status = item.status();
      if (status == 0) {
        unfetched++;
      } else if (status >= 200 && status < 300) {
        success++;
      } else if (status >= 300 && status < 400) {
        redirect++;
      } else if (status >= 400 && status < 500) {
        clientError++;
      } else if (status >= 500 && status < 600) {
        serverError++;
      }
    }
    return new StatusBuckets(unfetched, success, redirect, clientError, serverError);
  }
}
