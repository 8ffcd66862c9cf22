package org.springaicommunity.clabot;

import java.time.Duration;

/**
 * Connection settings for the GitHub App the bot runs as.
 *
 * <p>
 * The private key is given either inline as base64-encoded PEM or as a path to a PEM
 * file. Both the PKCS#1 keys GitHub issues and PKCS#8 conversions are accepted.
 */
public class GitHubAppProperties {

	/**
	 * GitHub App id.
	 */
	private String appId = "";

	/**
	 * Base64-encoded PEM private key.
	 */
	private String privateKeyBase64 = "";

	/**
	 * Path to a PEM private key file, used when no inline key is set.
	 */
	private String privateKeyPath = "";

	/**
	 * Shared secret for webhook signature verification.
	 */
	private String webhookSecret = "";

	/**
	 * GitHub REST API base URL.
	 */
	private String apiUrl = "https://api.github.com";

	/**
	 * Refresh installation tokens this long before they expire.
	 */
	private Duration tokenRefreshSkew = Duration.ofMinutes(1);

	/**
	 * Maximum retry attempts for failed API requests.
	 */
	private int maxRetries = 3;

	/**
	 * Initial delay between retries, doubled on each attempt.
	 */
	private Duration retryInitialDelay = Duration.ofSeconds(1);

	/**
	 * Check the required settings are present.
	 * @throws IllegalStateException listing every missing setting
	 */
	public void validate() {
		StringBuilder missing = new StringBuilder();
		if (isBlank(appId)) {
			missing.append(" GITHUB_APP_ID");
		}
		if (isBlank(webhookSecret)) {
			missing.append(" GITHUB_WEBHOOK_SECRET");
		}
		if (isBlank(privateKeyBase64) && isBlank(privateKeyPath)) {
			missing.append(" GITHUB_PRIVATE_KEY_BASE64|GITHUB_PRIVATE_KEY_PATH");
		}
		if (missing.length() > 0) {
			throw new IllegalStateException("Missing required GitHub settings:" + missing);
		}
	}

	private static boolean isBlank(String value) {
		return value == null || value.isBlank();
	}

	public String getAppId() {
		return appId;
	}

	public void setAppId(String appId) {
		this.appId = appId;
	}

	public String getPrivateKeyBase64() {
		return privateKeyBase64;
	}

	public void setPrivateKeyBase64(String privateKeyBase64) {
		this.privateKeyBase64 = privateKeyBase64;
	}

	public String getPrivateKeyPath() {
		return privateKeyPath;
	}

	public void setPrivateKeyPath(String privateKeyPath) {
		this.privateKeyPath = privateKeyPath;
	}

	public String getWebhookSecret() {
		return webhookSecret;
	}

	public void setWebhookSecret(String webhookSecret) {
		this.webhookSecret = webhookSecret;
	}

	public String getApiUrl() {
		return apiUrl;
	}

	public void setApiUrl(String apiUrl) {
		this.apiUrl = apiUrl;
	}

	public Duration getTokenRefreshSkew() {
		return tokenRefreshSkew;
	}

	public void setTokenRefreshSkew(Duration tokenRefreshSkew) {
		this.tokenRefreshSkew = tokenRefreshSkew;
	}

	public int getMaxRetries() {
		return maxRetries;
	}

	public void setMaxRetries(int maxRetries) {
		this.maxRetries = maxRetries;
	}

	public Duration getRetryInitialDelay() {
		return retryInitialDelay;
	}

	public void setRetryInitialDelay(Duration retryInitialDelay) {
		this.retryInitialDelay = retryInitialDelay;
	}

}
