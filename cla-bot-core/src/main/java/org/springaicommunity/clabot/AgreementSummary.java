package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * An agreement as reported by the agreement service.
 *
 * @param agreementRef agreement reference
 * @param title agreement title
 * @param status service-side status (e.g. {@code CURRENT_CONTRACT}, {@code SIGNING})
 * @param signedAt signature date, when signed
 */
public record AgreementSummary(String agreementRef, String title, String status, @Nullable Instant signedAt) {

	public static final String CURRENT_CONTRACT = "CURRENT_CONTRACT";

	/**
	 * Whether the agreement is signed and in force.
	 */
	public boolean isCurrentContract() {
		return CURRENT_CONTRACT.equals(status);
	}

}
