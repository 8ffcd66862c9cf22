package org.springaicommunity.clabot;

/**
 * Agreement lifecycle events the bot reacts to. Every other Concord event name decodes to
 * {@link #UNSUPPORTED}.
 */
public enum AgreementEventKind {

	/** Agreement fully executed. */
	EXECUTED("AGREEMENT_EXECUTED"),

	/** One signer signed; a CLA has a single signer, so this is as good as executed. */
	NEW_SIGNATURE("AGREEMENT_NEW_SIGNATURE"),

	CANCELLED("AGREEMENT_CANCELLED"),

	MOVED_TO_SIGNING("AGREEMENT_MOVE_TO_SIGNING"),

	UNSUPPORTED("");

	private final String wireName;

	AgreementEventKind(String wireName) {
		this.wireName = wireName;
	}

	public String wireName() {
		return wireName;
	}

	public static AgreementEventKind fromWireName(String eventName) {
		for (AgreementEventKind kind : values()) {
			if (kind != UNSUPPORTED && kind.wireName.equals(eventName)) {
				return kind;
			}
		}
		return UNSUPPORTED;
	}

}
