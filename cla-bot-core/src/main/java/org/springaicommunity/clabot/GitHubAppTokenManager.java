package org.springaicommunity.clabot;

import com.auth0.jwt.JWT;
import com.auth0.jwt.algorithms.Algorithm;
import org.kohsuke.github.GHAppInstallation;
import org.kohsuke.github.GHAppInstallationToken;
import org.kohsuke.github.GitHub;
import org.kohsuke.github.GitHubBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Authenticates as the GitHub App and hands out installation access tokens.
 *
 * <p>
 * A short-lived RS256 JWT identifies the app; it is exchanged through the GitHub API for
 * an installation token, which is cached per installation until shortly before it
 * expires.
 */
public class GitHubAppTokenManager {

	private static final Logger logger = LoggerFactory.getLogger(GitHubAppTokenManager.class);

	private static final Duration JWT_TTL = Duration.ofMinutes(9);

	private static final Duration CLOCK_DRIFT = Duration.ofSeconds(30);

	private static final byte[] RSA_ALGORITHM_IDENTIFIER = { 0x30, 0x0d, 0x06, 0x09, 0x2a, (byte) 0x86, 0x48,
			(byte) 0x86, (byte) 0xf7, 0x0d, 0x01, 0x01, 0x01, 0x05, 0x00 };

	private final String appId;

	private final RSAPrivateKey privateKey;

	private final String apiUrl;

	private final Duration refreshSkew;

	private final Clock clock;

	private final Map<Long, CachedToken> tokens = new ConcurrentHashMap<>();

	public GitHubAppTokenManager(String appId, RSAPrivateKey privateKey, String apiUrl, Duration refreshSkew) {
		this(appId, privateKey, apiUrl, refreshSkew, Clock.systemUTC());
	}

	GitHubAppTokenManager(String appId, RSAPrivateKey privateKey, String apiUrl, Duration refreshSkew, Clock clock) {
		this.appId = appId.trim();
		this.privateKey = privateKey;
		this.apiUrl = apiUrl;
		this.refreshSkew = refreshSkew;
		this.clock = clock;
	}

	/**
	 * Create a token manager from the configured app id and private key.
	 * @throws IllegalStateException if the private key cannot be read or parsed
	 */
	public static GitHubAppTokenManager fromProperties(GitHubAppProperties properties) {
		return new GitHubAppTokenManager(properties.getAppId(), loadPrivateKey(properties), properties.getApiUrl(),
				properties.getTokenRefreshSkew());
	}

	/**
	 * Get a valid access token for an installation, creating a new one when the cached
	 * token is missing or about to expire.
	 * @param installationId GitHub App installation id
	 * @return installation access token
	 */
	public String installationToken(long installationId) {
		CachedToken cached = tokens.get(installationId);
		if (cached != null && !cached.isExpired(clock.instant(), refreshSkew)) {
			return cached.value();
		}
		CachedToken refreshed = tokens.compute(installationId, (id, current) -> {
			if (current != null && !current.isExpired(clock.instant(), refreshSkew)) {
				return current;
			}
			return createInstallationToken(id);
		});
		return refreshed.value();
	}

	/**
	 * List the ids of every installation of the app.
	 */
	public List<Long> listInstallationIds() {
		try {
			List<Long> ids = new ArrayList<>();
			for (GHAppInstallation installation : appClient().getApp().listInstallations()) {
				ids.add(installation.getId());
			}
			logger.debug("App {} has {} installations", appId, ids.size());
			return ids;
		}
		catch (IOException e) {
			throw new GitHubHttpClient.GitHubApiException("Failed to list app installations: " + e.getMessage(), e);
		}
	}

	private CachedToken createInstallationToken(long installationId) {
		try {
			GHAppInstallation installation = appClient().getApp().getInstallationById(installationId);
			GHAppInstallationToken token = installation.createToken().create();
			Date expiresAt = token.getExpiresAt();
			Instant expiry = expiresAt != null ? expiresAt.toInstant() : clock.instant().plus(Duration.ofHours(1));
			logger.debug("Created installation token for installation {}; expires at {}", installationId, expiry);
			return new CachedToken(token.getToken(), expiry);
		}
		catch (IOException e) {
			throw new GitHubHttpClient.GitHubApiException(
					"Failed to create token for installation " + installationId + ": " + e.getMessage(), e);
		}
	}

	private GitHub appClient() throws IOException {
		return new GitHubBuilder().withEndpoint(apiUrl).withJwtToken(createAppJwt()).build();
	}

	/**
	 * Signed JWT identifying the app, backdated to tolerate clock drift.
	 */
	String createAppJwt() {
		Instant issuedAt = clock.instant().minus(CLOCK_DRIFT);
		return JWT.create()
			.withIssuer(appId)
			.withIssuedAt(Date.from(issuedAt))
			.withExpiresAt(Date.from(issuedAt.plus(JWT_TTL)))
			.sign(Algorithm.RSA256(null, privateKey));
	}

	/**
	 * Load the private key from the inline base64 setting, or from the key file when no
	 * inline key is set.
	 * @throws IllegalStateException if the key is missing, unreadable or malformed
	 */
	public static RSAPrivateKey loadPrivateKey(GitHubAppProperties properties) {
		String pem;
		if (!properties.getPrivateKeyBase64().isBlank()) {
			try {
				pem = new String(Base64.getMimeDecoder().decode(properties.getPrivateKeyBase64().trim()),
						StandardCharsets.UTF_8);
			}
			catch (IllegalArgumentException e) {
				throw new IllegalStateException("GITHUB_PRIVATE_KEY_BASE64 is not valid base64", e);
			}
		}
		else if (!properties.getPrivateKeyPath().isBlank()) {
			try {
				pem = Files.readString(Path.of(properties.getPrivateKeyPath()));
			}
			catch (IOException e) {
				throw new IllegalStateException("Cannot read private key file " + properties.getPrivateKeyPath(),
						new UncheckedIOException(e));
			}
		}
		else {
			throw new IllegalStateException("No GitHub App private key configured");
		}
		return parsePrivateKey(pem);
	}

	/**
	 * Parse an RSA private key from PEM, in either PKCS#1 ("RSA PRIVATE KEY") or PKCS#8
	 * ("PRIVATE KEY") form.
	 * @throws IllegalStateException if the key cannot be parsed
	 */
	public static RSAPrivateKey parsePrivateKey(String pem) {
		boolean pkcs1 = pem.contains("BEGIN RSA PRIVATE KEY");
		String sanitized = pem.replaceAll("-----(BEGIN|END) (RSA )?PRIVATE KEY-----", "").replaceAll("\\s+", "");
		try {
			byte[] der = Base64.getDecoder().decode(sanitized);
			byte[] pkcs8 = pkcs1 ? wrapPkcs1(der) : der;
			return (RSAPrivateKey) KeyFactory.getInstance("RSA").generatePrivate(new PKCS8EncodedKeySpec(pkcs8));
		}
		catch (IllegalArgumentException | GeneralSecurityException e) {
			throw new IllegalStateException("Failed to parse GitHub App private key", e);
		}
	}

	/**
	 * Wrap a PKCS#1 RSAPrivateKey structure into a PKCS#8 PrivateKeyInfo.
	 */
	private static byte[] wrapPkcs1(byte[] pkcs1) {
		int keyLength = pkcs1.length;
		int totalLength = 3 + RSA_ALGORITHM_IDENTIFIER.length + 4 + keyLength;
		byte[] result = new byte[4 + totalLength];
		int i = 0;
		result[i++] = 0x30;
		result[i++] = (byte) 0x82;
		result[i++] = (byte) (totalLength >> 8);
		result[i++] = (byte) totalLength;
		// version 0
		result[i++] = 0x02;
		result[i++] = 0x01;
		result[i++] = 0x00;
		System.arraycopy(RSA_ALGORITHM_IDENTIFIER, 0, result, i, RSA_ALGORITHM_IDENTIFIER.length);
		i += RSA_ALGORITHM_IDENTIFIER.length;
		result[i++] = 0x04;
		result[i++] = (byte) 0x82;
		result[i++] = (byte) (keyLength >> 8);
		result[i++] = (byte) keyLength;
		System.arraycopy(pkcs1, 0, result, i, keyLength);
		return result;
	}

	private record CachedToken(String value, Instant expiresAt) {

		boolean isExpired(Instant now, Duration skew) {
			return !now.isBefore(expiresAt.minus(skew));
		}

	}

}
