package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

/**
 * Interface for GitHub REST API HTTP operations.
 *
 * <p>
 * One instance talks to the API on behalf of one installation. Keeps the platform client
 * testable and allows decorators such as {@link RetryingGitHubClient}.
 */
public interface GitHubClient {

	/**
	 * Execute a GET request to the GitHub REST API.
	 * @param path API path (e.g., "/repos/owner/repo") or full URL
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String get(String path);

	/**
	 * Execute a GET request with query parameters.
	 * @param path API path (without query string)
	 * @param queryString Query string (without leading ?)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String getWithQuery(String path, @Nullable String queryString);

	/**
	 * Execute a POST request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String, empty for 204 responses
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String post(String path, String body);

	/**
	 * Execute a PATCH request with a JSON body.
	 * @param path API path
	 * @param body Request body (JSON)
	 * @return Response body as String
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String patch(String path, String body);

	/**
	 * Execute a DELETE request.
	 * @param path API path
	 * @return Response body as String, usually empty
	 * @throws GitHubHttpClient.GitHubApiException if the request fails
	 */
	String delete(String path);

	/**
	 * Get the rate limit information from the most recent API response. Returns null if
	 * no rate limit headers have been observed yet.
	 * @return last observed RateLimitInfo, or null
	 */
	default @Nullable RateLimitInfo getLastRateLimitInfo() {
		return null;
	}

}
