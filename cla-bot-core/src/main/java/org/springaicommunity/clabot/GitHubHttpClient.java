package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * HTTP client for GitHub REST API calls using the JDK {@link HttpClient}.
 *
 * <p>
 * The authorization token is obtained from a {@link Supplier} on every request so that
 * short-lived installation tokens can be refreshed underneath a long-lived client. Rate
 * limit headers are extracted from all responses and made available via
 * {@link #getLastRateLimitInfo()}.
 */
public class GitHubHttpClient implements GitHubClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubHttpClient.class);

	public static final String DEFAULT_API_URL = "https://api.github.com";

	private static final String USER_AGENT = "cla-bot";

	private final HttpClient httpClient;

	private final String apiUrl;

	private final Supplier<String> tokenSupplier;

	private volatile @Nullable RateLimitInfo lastRateLimitInfo;

	public GitHubHttpClient(Supplier<String> tokenSupplier) {
		this(DEFAULT_API_URL, tokenSupplier);
	}

	public GitHubHttpClient(String apiUrl, Supplier<String> tokenSupplier) {
		this.apiUrl = apiUrl.endsWith("/") ? apiUrl.substring(0, apiUrl.length() - 1) : apiUrl;
		this.tokenSupplier = tokenSupplier;
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
	public String get(String path) {
		return send("GET", path, HttpRequest.BodyPublishers.noBody());
	}

	@Override
	public String getWithQuery(String path, @Nullable String queryString) {
		String url = path;
		if (queryString != null && !queryString.isEmpty()) {
			url += "?" + queryString;
		}
		return get(url);
	}

	@Override
	public String post(String path, String body) {
		return send("POST", path, HttpRequest.BodyPublishers.ofString(body));
	}

	@Override
	public String patch(String path, String body) {
		return send("PATCH", path, HttpRequest.BodyPublishers.ofString(body));
	}

	@Override
	public String delete(String path) {
		return send("DELETE", path, HttpRequest.BodyPublishers.noBody());
	}

	private String send(String method, String path, HttpRequest.BodyPublisher body) {
		String url = path.startsWith("http") ? path : apiUrl + path;
		logger.debug("{} {}", method, url);
		long start = System.currentTimeMillis();

		HttpRequest request = HttpRequest.newBuilder()
			.uri(URI.create(url))
			.header("Authorization", "token " + tokenSupplier.get())
			.header("Accept", "application/vnd.github+json")
			.header("X-GitHub-Api-Version", "2022-11-28")
			.header("Content-Type", "application/json")
			.header("User-Agent", USER_AGENT)
			.method(method, body)
			.build();

		try {
			String response = executeRequest(request);
			logger.debug("{} {} completed in {}ms ({} bytes)", method, url, System.currentTimeMillis() - start,
					response.length());
			return response;
		}
		catch (RuntimeException e) {
			logger.debug("{} {} failed after {}ms: {}", method, url, System.currentTimeMillis() - start,
					e.getMessage());
			throw e;
		}
	}

	private String executeRequest(HttpRequest request) {
		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

			// Rate limit headers come with every response, successful or not
			int remaining = parseIntHeader(response, "X-RateLimit-Remaining", -1);
			long reset = parseLongHeader(response, "X-RateLimit-Reset", -1);
			int limit = parseIntHeader(response, "X-RateLimit-Limit", -1);
			int used = parseIntHeader(response, "X-RateLimit-Used", -1);
			String resource = response.headers().firstValue("X-RateLimit-Resource").orElse("core");

			if (remaining >= 0) {
				this.lastRateLimitInfo = new RateLimitInfo(limit, remaining, reset, used, resource);
				if (remaining < 100) {
					logger.info("Rate limit low ({}): {}/{} remaining, resets at epoch {}", resource, remaining,
							limit, reset);
				}
			}

			int statusCode = response.statusCode();
			String responseBody = response.body() != null ? response.body() : "";
			if (statusCode >= 200 && statusCode < 300) {
				return responseBody;
			}
			else if (statusCode == 401) {
				throw new GitHubApiException("Unauthorized: installation token rejected", statusCode, responseBody,
						remaining, reset);
			}
			else if (statusCode == 403) {
				if (remaining == 0) {
					throw new GitHubApiException("Rate limit exceeded. Resets at epoch: " + reset, statusCode,
							responseBody, remaining, reset);
				}
				throw new GitHubApiException("Forbidden: " + responseBody, statusCode, responseBody, remaining, reset);
			}
			else if (statusCode == 404) {
				throw new GitHubApiException("Not found: " + request.uri(), statusCode, responseBody, remaining,
						reset);
			}
			else if (statusCode == 429) {
				throw new GitHubApiException("Too Many Requests (429). Resets at epoch: " + reset, statusCode,
						responseBody, remaining, reset);
			}
			else {
				throw new GitHubApiException("GitHub API error: " + statusCode, statusCode, responseBody, remaining,
						reset);
			}
		}
		catch (IOException e) {
			logger.error("HTTP request failed: {}", e.getMessage());
			throw new GitHubApiException("HTTP request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new GitHubApiException("HTTP request interrupted", e);
		}
	}

	private static int parseIntHeader(HttpResponse<?> response, String headerName, int defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Integer.parseInt(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	private static long parseLongHeader(HttpResponse<?> response, String headerName, long defaultValue) {
		return response.headers().firstValue(headerName).map(v -> {
			try {
				return Long.parseLong(v);
			}
			catch (NumberFormatException e) {
				return defaultValue;
			}
		}).orElse(defaultValue);
	}

	/**
	 * Exception thrown when GitHub API calls fail.
	 *
	 * <p>
	 * Carries rate limit information when available, enabling reset-aware retries in
	 * {@link RetryingGitHubClient}.
	 */
	public static class GitHubApiException extends RuntimeException {

		private final int statusCode;

		private final @Nullable String responseBody;

		private final int rateLimitRemaining;

		private final long resetEpochSeconds;

		public GitHubApiException(String message, int statusCode, String responseBody) {
			this(message, statusCode, responseBody, -1, -1);
		}

		public GitHubApiException(String message, int statusCode, String responseBody, int rateLimitRemaining,
				long resetEpochSeconds) {
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

		public boolean isNotFound() {
			return statusCode == 404;
		}

		/**
		 * Returns true if this exception represents a rate limit error (either 403 with
		 * remaining=0 or 429).
		 */
		public boolean isRateLimitError() {
			return (statusCode == 429) || (statusCode == 403 && rateLimitRemaining == 0);
		}

	}

}
