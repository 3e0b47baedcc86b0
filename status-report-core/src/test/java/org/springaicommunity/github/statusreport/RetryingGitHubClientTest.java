package org.springaicommunity.github.statusreport;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link RetryingGitHubClient}.
 *
 * Tests retry logic, exponential backoff, rate limit waits and pacing. Sleeps are
 * recorded instead of performed.
 */
@DisplayName("RetryingGitHubClient Tests")
@ExtendWith(MockitoExtension.class)
class RetryingGitHubClientTest {

	private static final String BODY = "{\"query\":\"{ viewer { login } }\"}";

	private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

	@Mock
	private GitHubClient mockDelegate;

	private final List<Long> sleeps = new ArrayList<>();

	private RetryingGitHubClient retryingClient;

	@BeforeEach
	void setUp() {
		retryingClient = builder().build();
	}

	private RetryingGitHubClient.Builder builder() {
		return RetryingGitHubClient.builder()
			.wrapping(mockDelegate)
			.maxRetries(3)
			.initialDelayMs(10)
			.clock(Clock.fixed(NOW, ZoneOffset.UTC))
			.sleeper(sleeps::add);
	}

	private static GitHubHttpClient.GitHubApiException error(int status) {
		return new GitHubHttpClient.GitHubApiException("HTTP " + status, status, "body");
	}

	@Test
	@DisplayName("Should delegate postGraphQL() to wrapped client")
	void shouldDelegatePostGraphQL() {
		when(mockDelegate.postGraphQL(BODY)).thenReturn("{\"data\":{}}");

		String result = retryingClient.postGraphQL(BODY);

		assertThat(result).isEqualTo("{\"data\":{}}");
		verify(mockDelegate, times(1)).postGraphQL(BODY);
		assertThat(sleeps).isEmpty();
	}

	@Nested
	@DisplayName("Retry Behavior Tests")
	class RetryBehaviorTest {

		@Test
		@DisplayName("Should retry on server error (5xx) with exponential backoff")
		void shouldRetryOnServerError() {
			when(mockDelegate.postGraphQL(BODY)).thenThrow(error(502)).thenThrow(error(500)).thenReturn("success");

			String result = retryingClient.postGraphQL(BODY);

			assertThat(result).isEqualTo("success");
			verify(mockDelegate, times(3)).postGraphQL(BODY);
			assertThat(sleeps).containsExactly(10L, 20L);
		}

		@Test
		@DisplayName("Should retry on network failures")
		void shouldRetryOnNetworkFailure() {
			when(mockDelegate.postGraphQL(BODY))
				.thenThrow(new GitHubHttpClient.GitHubApiException("HTTP request failed", new IOException("connection reset")))
				.thenReturn("success");

			assertThat(retryingClient.postGraphQL(BODY)).isEqualTo("success");
			verify(mockDelegate, times(2)).postGraphQL(BODY);
		}

		@Test
		@DisplayName("Should NOT retry on client errors")
		void shouldNotRetryOnClientError() {
			GitHubHttpClient.GitHubApiException unauthorized = error(401);
			when(mockDelegate.postGraphQL(BODY)).thenThrow(unauthorized);

			assertThatThrownBy(() -> retryingClient.postGraphQL(BODY)).isSameAs(unauthorized);
			verify(mockDelegate, times(1)).postGraphQL(BODY);
			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should NOT retry GraphQL errors reported with HTTP 200")
		void shouldNotRetryGraphQLErrors() {
			when(mockDelegate.postGraphQL(BODY)).thenThrow(error(200));

			assertThatThrownBy(() -> retryingClient.postGraphQL(BODY))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(mockDelegate, times(1)).postGraphQL(BODY);
		}

		@Test
		@DisplayName("Should stop after max retries and throw the last exception")
		void shouldStopAfterMaxRetries() {
			GitHubHttpClient.GitHubApiException last = error(503);
			when(mockDelegate.postGraphQL(BODY)).thenThrow(error(500), error(500), error(500)).thenThrow(last);

			assertThatThrownBy(() -> retryingClient.postGraphQL(BODY)).isSameAs(last);
			verify(mockDelegate, times(4)).postGraphQL(BODY);
			assertThat(sleeps).containsExactly(10L, 20L, 40L);
		}

		@Test
		@DisplayName("Should work with zero retries")
		void shouldWorkWithZeroRetries() {
			RetryingGitHubClient noRetry = builder().maxRetries(0).build();
			when(mockDelegate.postGraphQL(BODY)).thenThrow(error(500));

			assertThatThrownBy(() -> noRetry.postGraphQL(BODY)).isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(mockDelegate, times(1)).postGraphQL(BODY);
		}

	}

	@Nested
	@DisplayName("Rate Limit Retry Tests")
	class RateLimitTest {

		@Test
		@DisplayName("Should wait for the reset on 403 with no requests remaining")
		void shouldWaitForResetOn403() {
			GitHubHttpClient.GitHubApiException rateLimited = new GitHubHttpClient.GitHubApiException(
					"Rate limit exceeded", 403, "", 0, NOW.getEpochSecond() + 30);
			when(mockDelegate.postGraphQL(BODY)).thenThrow(rateLimited).thenReturn("success");

			assertThat(retryingClient.postGraphQL(BODY)).isEqualTo("success");
			assertThat(sleeps).containsExactly(31_000L);
		}

		@Test
		@DisplayName("Should NOT retry on 403 with requests remaining")
		void shouldNotRetryOnForbidden() {
			when(mockDelegate.postGraphQL(BODY))
				.thenThrow(new GitHubHttpClient.GitHubApiException("Forbidden", 403, "", 10, NOW.getEpochSecond() + 30));

			assertThatThrownBy(() -> retryingClient.postGraphQL(BODY))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
			verify(mockDelegate, times(1)).postGraphQL(BODY);
		}

		@Test
		@DisplayName("Should use backoff when the reset is in the past or too far away")
		void shouldUseBackoffForUnusableReset() {
			when(mockDelegate.postGraphQL(BODY))
				.thenThrow(new GitHubHttpClient.GitHubApiException("429", 429, "", 0, NOW.getEpochSecond() - 60))
				.thenThrow(new GitHubHttpClient.GitHubApiException("429", 429, "", 0, NOW.getEpochSecond() + 7200))
				.thenReturn("success");

			assertThat(retryingClient.postGraphQL(BODY)).isEqualTo("success");
			assertThat(sleeps).containsExactly(10L, 20L);
		}

	}

	@Nested
	@DisplayName("Proactive Pacing Tests")
	class PacingTest {

		@Test
		@DisplayName("Should pace when remaining is below threshold")
		void shouldPaceWhenRemainingBelowThreshold() {
			when(mockDelegate.postGraphQL(BODY)).thenReturn("ok");
			when(mockDelegate.getLastRateLimitInfo())
				.thenReturn(new RateLimitInfo(5000, 10, NOW.getEpochSecond() + 20, 4990));

			retryingClient.postGraphQL(BODY);

			assertThat(sleeps).containsExactly(2000L);
		}

		@Test
		@DisplayName("Should clamp pacing to the maximum")
		void shouldClampPacing() {
			when(mockDelegate.postGraphQL(BODY)).thenReturn("ok");
			when(mockDelegate.getLastRateLimitInfo())
				.thenReturn(new RateLimitInfo(5000, 1, NOW.getEpochSecond() + 3600, 4999));

			retryingClient.postGraphQL(BODY);

			assertThat(sleeps).containsExactly(10_000L);
		}

		@Test
		@DisplayName("Should NOT pace when remaining is above threshold")
		void shouldNotPaceAboveThreshold() {
			when(mockDelegate.postGraphQL(BODY)).thenReturn("ok");
			when(mockDelegate.getLastRateLimitInfo())
				.thenReturn(new RateLimitInfo(5000, 4000, NOW.getEpochSecond() + 20, 1000));

			retryingClient.postGraphQL(BODY);

			assertThat(sleeps).isEmpty();
		}

		@Test
		@DisplayName("Should delegate getLastRateLimitInfo to wrapped client")
		void shouldDelegateRateLimitInfo() {
			RateLimitInfo info = new RateLimitInfo(5000, 4000, NOW.getEpochSecond(), 1000);
			when(mockDelegate.getLastRateLimitInfo()).thenReturn(info);

			assertThat(retryingClient.getLastRateLimitInfo()).isSameAs(info);
		}

	}

	@Nested
	@DisplayName("Builder Tests")
	class BuilderTest {

		@Test
		@DisplayName("Should accept Duration for initial delay")
		void shouldAcceptDurationForInitialDelay() {
			RetryingGitHubClient client = builder().initialDelay(Duration.ofMillis(250)).build();
			when(mockDelegate.postGraphQL(BODY)).thenThrow(error(500)).thenReturn("ok");

			client.postGraphQL(BODY);

			assertThat(sleeps).containsExactly(250L);
		}

		@Test
		@DisplayName("Should reject missing delegate")
		void shouldRejectMissingDelegate() {
			assertThatThrownBy(() -> RetryingGitHubClient.builder().build()).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("wrapping()");
		}

		@Test
		@DisplayName("Should reject negative max retries")
		void shouldRejectNegativeMaxRetries() {
			assertThatThrownBy(() -> builder().maxRetries(-1).build()).isInstanceOf(IllegalStateException.class);
		}

		@Test
		@DisplayName("Should reject non-positive initial delay")
		void shouldRejectNonPositiveInitialDelay() {
			assertThatThrownBy(() -> builder().initialDelayMs(0).build()).isInstanceOf(IllegalStateException.class);
		}

	}

}
