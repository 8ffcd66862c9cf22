package org.springaicommunity.clabot;

import java.time.Instant;

/**
 * Rate limit information from the GitHub API response headers.
 *
 * @param limit the maximum number of requests allowed in the window
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 * @param resource the rate limit bucket the request counted against (e.g. "core")
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used, String resource) {

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	public boolean isExceeded() {
		return remaining <= 0;
	}

}
