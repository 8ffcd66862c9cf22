package org.springaicommunity.clabot;

import java.util.Locale;

/**
 * Lifecycle status of a contributor's license agreement.
 */
public enum ClaStatus {

	PENDING, SIGNED, EXPIRED, CANCELLED;

	/**
	 * Value stored in the record store and written to logs.
	 * @return lower-case status name
	 */
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Parse a stored status value.
	 * @param value status as stored ("pending", "signed", ...)
	 * @return matching status
	 * @throws IllegalArgumentException for unknown values
	 */
	public static ClaStatus fromValue(String value) {
		return ClaStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
	}

}
