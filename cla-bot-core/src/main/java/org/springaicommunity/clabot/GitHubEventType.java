package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

/**
 * GitHub webhook event types, from the {@code X-GitHub-Event} header.
 */
public enum GitHubEventType {

	PULL_REQUEST, ISSUE_COMMENT, PING, UNSUPPORTED;

	public static GitHubEventType fromHeader(@Nullable String header) {
		if (header == null) {
			return UNSUPPORTED;
		}
		return switch (header) {
			case "pull_request" -> PULL_REQUEST;
			case "issue_comment" -> ISSUE_COMMENT;
			case "ping" -> PING;
			default -> UNSUPPORTED;
		};
	}

}
