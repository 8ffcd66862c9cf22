package org.springaicommunity.clabot;

import java.util.Locale;

/**
 * Pull request webhook actions. Only {@link #OPENED}, {@link #SYNCHRONIZE} and
 * {@link #REOPENED} trigger a CLA check; everything else decodes to {@link #OTHER}.
 */
public enum PullRequestAction {

	OPENED, SYNCHRONIZE, REOPENED, CLOSED, EDITED, OTHER;

	public static PullRequestAction fromWireName(String action) {
		return switch (action.trim().toLowerCase(Locale.ROOT)) {
			case "opened" -> OPENED;
			case "synchronize" -> SYNCHRONIZE;
			case "reopened" -> REOPENED;
			case "closed" -> CLOSED;
			case "edited" -> EDITED;
			default -> OTHER;
		};
	}

}
