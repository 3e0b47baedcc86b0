package org.springaicommunity.github.statusreport;

import org.jspecify.annotations.Nullable;

/**
 * Transport for GitHub GraphQL requests.
 *
 * <p>
 * Implementations send a complete request body and hand back the raw response text;
 * interpreting the payload is left to {@link ProjectService}. Decorators such as
 * {@link RetryingGitHubClient} wrap another client.
 */
public interface GitHubClient {

	/**
	 * Execute a POST request against the GraphQL endpoint.
	 * @param body request body, a JSON object with {@code query} and {@code variables}
	 * @return response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String postGraphQL(String body);

	/**
	 * Get the rate limit information from the most recent API response.
	 * @return last observed RateLimitInfo, or null before the first response
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
