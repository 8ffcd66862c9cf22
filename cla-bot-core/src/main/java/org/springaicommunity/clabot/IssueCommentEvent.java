package org.springaicommunity.clabot;

/**
 * A new comment on an issue or pull request, decoded from the GitHub webhook payload.
 *
 * @param action the comment action ("created", "edited", "deleted")
 * @param repository the repository
 * @param number the issue or pull request number
 * @param pullRequest whether the comment was made on a pull request
 * @param author the author of the issue or pull request
 * @param commenter the user who wrote the comment
 * @param body the comment body
 * @param installationId the GitHub App installation that delivered the event
 */
public record IssueCommentEvent(String action, RepositoryRef repository, int number, boolean pullRequest,
		Contributor author, String commenter, String body, long installationId) {

	public boolean isNewPullRequestComment() {
		return pullRequest && "created".equals(action);
	}

}
