package org.springaicommunity.github.statusreport;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Decorator that retries GraphQL requests of another {@link GitHubClient}.
 *
 * <p>
 * Network failures and 5xx responses are retried with exponential backoff. Rate limit
 * responses (429, or 403 with no requests remaining) wait until the advertised reset when
 * it is less than an hour away. Other 4xx responses and GraphQL errors are not retried.
 * After a successful response the client slows down when few requests remain, spreading
 * them until the reset.
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(url, token))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	private static final long MAX_RESET_WAIT_SECONDS = 3600;

	private static final long MAX_PACING_MS = 10_000;

	private static final long MIN_PACING_MS = 100;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private final int pacingThreshold;

	private final Clock clock;

	private final Sleeper sleeper;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
		this.pacingThreshold = builder.pacingThreshold;
		this.clock = builder.clock;
		this.sleeper = builder.sleeper;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	@Override
	public String postGraphQL(String body) {
		long delay = initialDelayMs;
		int attempts = maxRetries + 1;
		for (int attempt = 1;; attempt++) {
			try {
				String result = delegate.postGraphQL(body);
				paceIfNeeded();
				return result;
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				if (!e.isTransient()) {
					throw e;
				}
				if (attempt >= attempts) {
					logger.error("GraphQL request failed after {} attempts: {}", attempts, e.getMessage());
					throw e;
				}
				long waitMs = computeWaitTime(e, delay);
				logger.warn("GraphQL request failed (attempt {}/{}): {}. Waiting {}ms...", attempt, attempts,
						e.getMessage(), waitMs);
				sleep(waitMs);
				delay *= 2;
			}
		}
	}

	/**
	 * Wait until the rate limit reset (plus one second) when it is known and near,
	 * otherwise use the backoff delay.
	 */
	private long computeWaitTime(GitHubHttpClient.GitHubApiException e, long backoffMs) {
		if (e.isRateLimitError() && e.getResetEpochSeconds() > 0) {
			long waitSeconds = e.getResetEpochSeconds() - clock.instant().getEpochSecond() + 1;
			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						e.getResetEpochSeconds());
				return waitSeconds * 1000;
			}
			if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
				logger.warn("Rate limit reset is {} seconds away, using exponential backoff instead", waitSeconds);
			}
		}
		return backoffMs;
	}

	private void paceIfNeeded() {
		RateLimitInfo info = delegate.getLastRateLimitInfo();
		if (info == null || info.remaining() <= 0 || info.remaining() >= pacingThreshold) {
			return;
		}
		long secondsUntilReset = info.reset() - clock.instant().getEpochSecond();
		if (secondsUntilReset > 0) {
			long paceMs = Math.max(MIN_PACING_MS, Math.min(MAX_PACING_MS, secondsUntilReset * 1000 / info.remaining()));
			logger.debug("Pacing: {}/{} remaining, sleeping {}ms", info.remaining(), info.limit(), paceMs);
			sleep(paceMs);
		}
	}

	private void sleep(long ms) {
		try {
			sleeper.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Retry interrupted", e);
		}
	}

	/**
	 * Pause strategy, replaceable in tests.
	 */
	@FunctionalInterface
	public interface Sleeper {

		void sleep(long millis) throws InterruptedException;

	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults: 3 retries, 1 second initial
	 * delay, pacing below 100 remaining requests.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

		private int pacingThreshold = 100;

		private Clock clock = Clock.systemUTC();

		private Sleeper sleeper = Thread::sleep;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the GitHubClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(GitHubClient client) {
			this.delegate = client;
			return this;
		}

		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the delay before the first retry; it doubles on each further retry.
		 * @param delay initial delay (default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Start pacing requests when fewer than this many remain.
		 * @param threshold remaining request threshold (default: 100)
		 * @return this builder
		 */
		public Builder pacingThreshold(int threshold) {
			this.pacingThreshold = threshold;
			return this;
		}

		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		public Builder sleeper(Sleeper sleeper) {
			this.sleeper = sleeper;
			return this;
		}

		/**
		 * Build the RetryingGitHubClient.
		 * @return configured RetryingGitHubClient
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingGitHubClient build() {
			if (delegate == null) {
				throw new IllegalStateException("A GitHubClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingGitHubClient(this);
		}

	}

}
