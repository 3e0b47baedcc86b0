package org.springaicommunity.github.statusreport;

import java.time.Instant;

/**
 * Rate limit headers of a GitHub API response.
 *
 * @param limit the maximum number of requests allowed per hour
 * @param remaining the number of requests remaining in the current window
 * @param reset the time when the rate limit resets (epoch seconds)
 * @param used the number of requests used in the current window
 */
public record RateLimitInfo(int limit, int remaining, long reset, int used) {

	public Instant getResetTime() {
		return Instant.ofEpochSecond(reset);
	}

	/**
	 * Returns true if the rate limit has been exhausted.
	 * @return true if no requests remaining
	 */
	public boolean isExceeded() {
		return remaining <= 0;
	}

}
