package org.springaicommunity.clabot;

/**
 * Current state of a pull request as reported by GitHub.
 *
 * @param number pull request number
 * @param state "open" or "closed"
 * @param headSha SHA of the head commit
 * @param authorLogin login of the pull request author
 * @param authorId user id of the pull request author
 * @param htmlUrl web URL of the pull request
 */
public record PullRequestDetails(int number, String state, String headSha, String authorLogin, long authorId,
		String htmlUrl) {

	public boolean isOpen() {
		return "open".equals(state);
	}

}
