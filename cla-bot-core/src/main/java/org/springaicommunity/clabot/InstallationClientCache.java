package org.springaicommunity.clabot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongFunction;

/**
 * Authenticated {@link GitHubClient} per GitHub App installation, created on first use
 * and kept for the lifetime of the cache.
 *
 * <p>
 * Clients fetch their token on every request, so a cached client stays usable after the
 * installation token it started with has expired.
 */
public class InstallationClientCache {

	private static final Logger logger = LoggerFactory.getLogger(InstallationClientCache.class);

	private final Map<Long, GitHubClient> clients = new ConcurrentHashMap<>();

	private final LongFunction<GitHubClient> clientFactory;

	public InstallationClientCache(LongFunction<GitHubClient> clientFactory) {
		this.clientFactory = clientFactory;
	}

	/**
	 * Cache whose clients authenticate through the token manager and retry as configured.
	 */
	public static InstallationClientCache create(GitHubAppTokenManager tokenManager, GitHubAppProperties properties) {
		return new InstallationClientCache(installationId -> RetryingGitHubClient.builder()
			.wrapping(new GitHubHttpClient(properties.getApiUrl(),
					() -> tokenManager.installationToken(installationId)))
			.maxRetries(properties.getMaxRetries())
			.initialDelay(properties.getRetryInitialDelay())
			.build());
	}

	/**
	 * Get the client for an installation, creating and storing it if absent.
	 */
	public GitHubClient forInstallation(long installationId) {
		return clients.computeIfAbsent(installationId, id -> {
			logger.debug("Creating GitHub client for installation {}", id);
			return clientFactory.apply(id);
		});
	}

}
