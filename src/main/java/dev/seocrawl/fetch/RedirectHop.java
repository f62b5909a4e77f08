package dev.seocrawl.fetch;

/**
 * One followed redirect: the URL requested, the resolved {@code Location}, and the 3xx status.
 *
 * @param from URL that answered with a redirect
 * @param to absolute URL the redirect pointed at
 * @param status redirect status code (301, 302, 303, 307 or 308)
 */
public record RedirectHop(String from, String to, int status) {}
