package org.springaicommunity.clabot;

import java.util.List;
import java.util.Optional;

/**
 * Operations the bot performs on the code-hosting platform.
 *
 * <p>
 * Repository-scoped calls take the id of the GitHub App installation that has access to
 * the repository. Failures surface as {@link GitHubHttpClient.GitHubApiException} unless a
 * method documents a degraded result instead.
 */
public interface PlatformClient {

	PullRequestDetails getPullRequest(long installationId, RepositoryRef repository, int number);

	/**
	 * Distinct commit author emails of a pull request, in commit order.
	 * @return the emails, or an empty list if the commits could not be read
	 */
	List<String> listCommitAuthorEmails(long installationId, RepositoryRef repository, int number);

	/**
	 * Public profile email of a user.
	 * @return the email, or empty if none is public or the lookup failed
	 */
	Optional<String> getPublicEmail(long installationId, String username);

	/**
	 * Create the label in the repository unless it already exists.
	 */
	void ensureLabel(long installationId, RepositoryRef repository, LabelDefinition label);

	void addLabel(long installationId, RepositoryRef repository, int number, String label);

	/**
	 * Remove a label from an issue or pull request.
	 * @return false if the label was not applied
	 */
	boolean removeLabel(long installationId, RepositoryRef repository, int number, String label);

	void createCommitStatus(long installationId, RepositoryRef repository, String sha, CommitStatus status);

	/**
	 * Post a comment on an issue or pull request.
	 * @return the id of the new comment
	 */
	long createComment(long installationId, RepositoryRef repository, int number, String body);

	void updateComment(long installationId, RepositoryRef repository, long commentId, String body);

	/**
	 * Whether a user is a member of an organization. Lookup failures other than "not a
	 * member" are logged and reported as false.
	 */
	boolean isOrganizationMember(long installationId, String organization, String username);

	/**
	 * Ids of every installation of the GitHub App.
	 */
	List<Long> listInstallationIds();

	/**
	 * Repositories the installation can access.
	 */
	List<RepositoryRef> listInstallationRepositories(long installationId);

}
