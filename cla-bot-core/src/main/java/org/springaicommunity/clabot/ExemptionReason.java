package org.springaicommunity.clabot;

/**
 * Why a contributor does not need to sign.
 */
public enum ExemptionReason {

	ALLOW_LISTED("CLA not required (allow-listed contributor)"),

	ORGANIZATION_MEMBER("CLA not required (organization member)");

	private final String statusDescription;

	ExemptionReason(String statusDescription) {
		this.statusDescription = statusDescription;
	}

	public String statusDescription() {
		return statusDescription;
	}

}
