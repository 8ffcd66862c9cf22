package org.springaicommunity.clabot;

/**
 * A pull request lifecycle event, decoded from the GitHub webhook payload.
 *
 * @param action the lifecycle action
 * @param repository the repository the pull request belongs to
 * @param number the pull request number
 * @param contributor the pull request author
 * @param headSha the head commit SHA at the time of the event
 * @param installationId the GitHub App installation that delivered the event
 */
public record PullRequestEvent(PullRequestAction action, RepositoryRef repository, int number,
		Contributor contributor, String headSha, long installationId) {
}
