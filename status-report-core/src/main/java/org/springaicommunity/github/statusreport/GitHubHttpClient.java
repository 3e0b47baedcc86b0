package org.springaicommunity.github.statusreport;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link GitHubClient} backed by the JDK {@link HttpClient}.
 *
 * <p>
 * Requests go to a configurable GraphQL endpoint (GitHub Enterprise installations use a
 * different URL) with a bearer token. Rate limit headers are captured from every response
 * and exposed through {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	/**
	 * The public GitHub GraphQL endpoint.
	 */
	public static final String DEFAULT_GRAPHQL_URL = "https://api.github.com/graphql";

	private static final String USER_AGENT = "github-status-report";

	private final HttpClient httpClient;

	private final URI endpoint;

	private final String token;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(String token) {
		this(DEFAULT_GRAPHQL_URL, token);
	}

	/**
	 * Create a client for a specific GraphQL endpoint.
	 * @param url the GraphQL endpoint URL
	 * @param token the GitHub token sent as bearer credentials
	 */
	public GitHubHttpClient(String url, String token) {
		this.endpoint = URI.create(url);
		this.token = token;
		this.httpClient = HttpClient.newBuilder()
			.connectTimeout(Duration.ofSeconds(30))
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build();
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return lastRateLimitInfo;
	}

	@Override
	public String postGraphQL(String body) {
		logger.debug("POST {} ({} bytes)", endpoint, body.length());
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(endpoint)
			.header("Authorization", "Bearer " + token)
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.POST(HttpRequest.BodyPublishers.ofString(body))
			.build();

		try {
			String response = execute(request);
			logger.debug("POST {} completed in {}ms ({} bytes)", endpoint, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (GitHubApiException e) {
			logger.debug("POST {} failed after {}ms: {}", endpoint, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String execute(HttpRequest request) {
		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.error("GraphQL request to {} failed: {}", endpoint, e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}

		int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
		long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
		if (remaining >= 0) {
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);
			this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used);
			if (remaining < 100) {
				logger.info("Rate limit low: {}/{} remaining, resets at epoch {}", remaining, limit, reset);
			}
		}

		int statusCode = response.statusCode();
		String body = response.body();
		if (statusCode >= 200 && statusCode < 300) {
			return body;
		}
		String message = switch (statusCode) {
			case 401 -> "Unauthorized: bad credentials, check the configured token";
			case 403 -> remaining == 0 ? "Rate limit exceeded. Resets at epoch: " + reset : "Forbidden: " + body;
			case 404 -> "Not found: " + endpoint;
			case 429 -> "Too Many Requests (429). Resets at epoch: " + reset;
			default -> "GitHub API error: " + statusCode;
		};
		throw new GitHubApiException(message, statusCode, body, remaining, reset);
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return (int) parseLongHeader(response, headerName, defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v.trim());
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when a GitHub API call fails, either at the HTTP level or with a
	 * GraphQL {@code errors} payload.
	 *
	 * <p>
	 * Carries rate limit information when available so that {@link RetryingGitHubClient}
	 * can wait for the reset instead of backing off blindly.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, @Nullable String responseBody,
				int rateLimitRemaining, long resetEpochSeconds) {
			super(message);
			this.statusCode = statusCode;
			this.responseBody = responseBody;
			this.rateLimitRemaining = rateLimitRemaining;
			this.resetEpochSeconds = resetEpochSeconds;
		}

		public GitHubApiException(String message, Throwable cause) {
			super(message, cause);
			this.statusCode = -1;
			this.responseBody = null;
			this.rateLimitRemaining = -1;
			this.resetEpochSeconds = -1;
		}

		public int getStatusCode() {
			return statusCode;
		}

		public @Nullable String getResponseBody() {
			return responseBody;
		}

		public int getRateLimitRemaining() {
			return rateLimitRemaining;
		}

		public long getResetEpochSeconds() {
			return resetEpochSeconds;
		}

		/**
		 * Returns true for a 429 or a 403 with no requests remaining.
		 * @return true if waiting for the reset may help
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

		/**
		 * Returns true if retrying the same request may succeed: network failures, server
		 * errors and rate limiting.
		 * @return true for transient failures
		 */
		public boolean isTransient() {
			return statusCode < 0 || statusCode >= 500 || isRateLimitError();
		}

	}

}
