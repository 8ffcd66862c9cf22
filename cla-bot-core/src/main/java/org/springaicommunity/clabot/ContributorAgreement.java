package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * Stored CLA state of one contributor, keyed by GitHub user id.
 *
 * @param username GitHub login at the time the record was written
 * @param userId GitHub user id (unique)
 * @param email email the agreement was sent to, if known
 * @param agreementRef reference of the agreement in the agreement service
 * @param status current status
 * @param signedAt when the agreement was signed (only set for signed agreements)
 * @param createdAt when the record was created (null before it is stored)
 * @param updatedAt when the record was last updated (null before it is stored)
 */
public record ContributorAgreement(String username, long userId, @Nullable String email, String agreementRef,
		ClaStatus status, @Nullable Instant signedAt, @Nullable Instant createdAt, @Nullable Instant updatedAt) {

	/**
	 * New pending agreement record, not yet stored.
	 */
	public static ContributorAgreement pending(Contributor contributor, String email, String agreementRef) {
		return new ContributorAgreement(contributor.login(), contributor.id(), email, agreementRef, ClaStatus.PENDING,
				null, null, null);
	}

	/**
	 * New signed agreement record, not yet stored.
	 */
	public static ContributorAgreement signed(Contributor contributor, String email, String agreementRef,
			Instant signedAt) {
		return new ContributorAgreement(contributor.login(), contributor.id(), email, agreementRef, ClaStatus.SIGNED,
				signedAt, null, null);
	}

	public boolean isSigned() {
		return status == ClaStatus.SIGNED;
	}

	public boolean isPending() {
		return status == ClaStatus.PENDING;
	}

}
