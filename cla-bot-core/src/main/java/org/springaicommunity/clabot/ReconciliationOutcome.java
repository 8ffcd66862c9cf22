package org.springaicommunity.clabot;

/**
 * Terminal state a pull request event was reconciled to.
 */
public enum ReconciliationOutcome {

	/** Action that does not affect the CLA check. */
	IGNORED,

	EXEMPT,

	/** Contributor already had a signed agreement on record. */
	SIGNED,

	/** Agreement already requested for this pull request; only the status was refreshed. */
	PENDING_REFRESHED,

	/** A signed agreement was found in the agreement service and recorded. */
	SIGNED_EXTERNALLY,

	AGREEMENT_REQUESTED,

	/** Agreement creation failed; the pull request asks for manual follow-up. */
	AGREEMENT_FAILED

}
