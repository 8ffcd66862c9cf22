package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Decorator that adds automatic retry logic to a {@link GitHubClient}.
 *
 * <p>
 * Reads and writes are treated differently:
 * <ul>
 * <li>GET requests retry transient failures (5xx, network) with exponential backoff and
 * rate limit failures with reset-aware backoff</li>
 * <li>POST, PATCH and DELETE requests retry only rate limit failures (403 with
 * remaining=0, or 429), which GitHub rejects before applying the write. A write that
 * failed for any other reason may already have taken effect and is not repeated.</li>
 * </ul>
 *
 * <pre>
 * {@code
 * GitHubClient client = RetryingGitHubClient.builder()
 *     .wrapping(new GitHubHttpClient(tokenSupplier))
 *     .maxRetries(5)
 *     .initialDelay(Duration.ofSeconds(2))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingGitHubClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingGitHubClient.class);

	/**
	 * Maximum time to wait for a rate limit reset. A webhook should not hang for longer
	 * than this; beyond it the exponential delay is used instead.
	 */
	private static final long MAX_RESET_WAIT_SECONDS = 60;

	private final GitHubClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingGitHubClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public String get(String path) {
		return executeWithRetry(() -> delegate.get(path), "GET " + path, true);
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String desc = "GET " + path + (queryString != null ? "?" + queryString : "");
		return executeWithRetry(() -> delegate.getWithQuery(path, queryString), desc, true);
	}

	@Override
	public String post(String path, String body) {
		return executeWithRetry(() -> delegate.post(path, body), "POST " + path, false);
	}

	@Override
	public String patch(String path, String body) {
		return executeWithRetry(() -> delegate.patch(path, body), "PATCH " + path, false);
	}

	@Override
	public String delete(String path) {
		return executeWithRetry(() -> delegate.delete(path), "DELETE " + path, false);
	}

	@Override
	public @Nullable RateLimitInfo getLastRateLimitInfo() {
		return delegate.getLastRateLimitInfo();
	}

	private String executeWithRetry(RequestSupplier supplier, String description, boolean idempotent) {
		RuntimeException lastException = null;
		long delay = initialDelayMs;

		for (int attempt = 0; attempt <= maxRetries; attempt++) {
			try {
				return supplier.get();
			}
			catch (GitHubHttpClient.GitHubApiException e) {
				lastException = e;
				if (!isRetryable(e, idempotent)) {
					throw e;
				}
				if (attempt < maxRetries) {
					long waitMs = computeWaitTime(e, delay);
					logger.warn("{} failed (attempt {}/{}): {}. Waiting {}ms...", description, attempt + 1,
							maxRetries + 1, e.getMessage(), waitMs);
					sleep(waitMs);
					delay *= 2;
				}
			}
			catch (RuntimeException e) {
				lastException = e;
				if (!idempotent) {
					throw e;
				}
				if (attempt < maxRetries) {
					logger.warn("{} failed (attempt {}/{}): {}. Retrying in {}ms...", description, attempt + 1,
							maxRetries + 1, e.getMessage(), delay);
					sleep(delay);
					delay *= 2;
				}
			}
		}

		logger.error("{} failed after {} attempts", description, maxRetries + 1);
		throw lastException;
	}

	private static boolean isRetryable(GitHubHttpClient.GitHubApiException e, boolean idempotent) {
		if (e.isRateLimitError()) {
			return true;
		}
		if (!idempotent) {
			return false;
		}
		// Client errors are final, everything else (5xx, transport) is transient
		return e.getStatusCode() < 400 || e.getStatusCode() >= 500;
	}

	/**
	 * For rate limit errors with a known reset time, wait until that time (+1s buffer).
	 * Otherwise use the exponential backoff delay.
	 */
	private long computeWaitTime(GitHubHttpClient.GitHubApiException e, long defaultDelay) {
		if (e.isRateLimitError() && e.getResetEpochSeconds() > 0) {
			long waitSeconds = e.getResetEpochSeconds() - Instant.now().getEpochSecond() + 1;
			if (waitSeconds > 0 && waitSeconds <= MAX_RESET_WAIT_SECONDS) {
				logger.info("Rate limit exceeded. Waiting {} seconds until reset at epoch {}", waitSeconds,
						e.getResetEpochSeconds());
				return waitSeconds * 1000;
			}
			else if (waitSeconds > MAX_RESET_WAIT_SECONDS) {
				logger.warn("Rate limit reset is {} seconds away, using exponential backoff instead", waitSeconds);
			}
		}
		return defaultDelay;
	}

	private void sleep(long ms) {
		try {
			Thread.sleep(ms);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubHttpClient.GitHubApiException("Retry interrupted", e);
		}
	}

	@FunctionalInterface
	private interface RequestSupplier {

		String get();

	}

	/**
	 * Builder for {@link RetryingGitHubClient}. Defaults to 3 retries starting at a one
	 * second delay.
	 */
	public static class Builder {

		private @Nullable GitHubClient delegate;

		private int maxRetries = 3;

		private long initialDelayMs = 1000;

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
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
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
