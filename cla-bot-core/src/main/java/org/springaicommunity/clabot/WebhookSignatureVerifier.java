package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * Verifies the {@code X-Hub-Signature-256} header GitHub sends with each webhook: an
 * HMAC-SHA256 of the raw request body keyed with the webhook secret, hex encoded and
 * prefixed with {@code sha256=}.
 */
public class WebhookSignatureVerifier {

	private static final String ALGORITHM = "HmacSHA256";

	private static final String PREFIX = "sha256=";

	private final SecretKeySpec key;

	public WebhookSignatureVerifier(String secret) {
		if (secret.isEmpty()) {
			throw new IllegalArgumentException("Webhook secret must not be empty");
		}
		this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM);
	}

	/**
	 * Check a signature header against the body. Comparison takes the same time wherever
	 * the first mismatching byte is.
	 * @param body raw request body, exactly as received
	 * @param signatureHeader header value, may be missing
	 * @return true if the signature is present and matches
	 */
	public boolean verify(byte[] body, @Nullable String signatureHeader) {
		if (signatureHeader == null || !signatureHeader.startsWith(PREFIX)) {
			return false;
		}
		byte[] expected = sign(body).getBytes(StandardCharsets.US_ASCII);
		byte[] actual = signatureHeader.trim().getBytes(StandardCharsets.US_ASCII);
		return MessageDigest.isEqual(expected, actual);
	}

	/**
	 * Compute the header value for a body.
	 */
	public String sign(byte[] body) {
		try {
			Mac mac = Mac.getInstance(ALGORITHM);
			mac.init(key);
			return PREFIX + HexFormat.of().formatHex(mac.doFinal(body));
		}
		catch (GeneralSecurityException e) {
			throw new IllegalStateException("HmacSHA256 not available", e);
		}
	}

}
