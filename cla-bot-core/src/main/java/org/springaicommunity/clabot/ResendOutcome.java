package org.springaicommunity.clabot;

/**
 * What a {@code /cla resend} comment led to.
 */
public enum ResendOutcome {

	/** Not a resend command on a pull request. */
	IGNORED,

	/** Author is allow-listed or an organization member. */
	EXEMPT,

	ALREADY_SIGNED,

	INVITATION_RESENT,

	NEW_AGREEMENT_SENT,

	FAILED

}
