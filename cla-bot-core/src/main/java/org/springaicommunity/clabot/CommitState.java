package org.springaicommunity.clabot;

import java.util.Locale;

/**
 * Commit status states the bot reports.
 */
public enum CommitState {

	SUCCESS, PENDING;

	/**
	 * Lower-case name as the statuses API expects it.
	 */
	public String value() {
		return name().toLowerCase(Locale.ROOT);
	}

}
