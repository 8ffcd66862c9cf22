package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

import java.time.Instant;

/**
 * A pull request the bot has recorded as requiring a CLA decision, keyed by repository,
 * number and contributor id.
 *
 * @param repository repository full name ("owner/repo")
 * @param number pull request number
 * @param username contributor login
 * @param userId contributor GitHub user id
 * @param commentId id of the bot's pending-signature comment, once posted
 * @param agreementRef agreement reference, once an agreement exists for this PR
 * @param createdAt when the row was created (null before it is stored)
 * @param updatedAt when the row was last updated (null before it is stored)
 */
public record TrackedPullRequest(String repository, int number, String username, long userId,
		@Nullable Long commentId, @Nullable String agreementRef, @Nullable Instant createdAt,
		@Nullable Instant updatedAt) {

	/**
	 * New tracking row for a contributor's pull request, not yet stored.
	 */
	public static TrackedPullRequest of(RepositoryRef repository, int number, Contributor contributor,
			@Nullable Long commentId, @Nullable String agreementRef) {
		return new TrackedPullRequest(repository.fullName(), number, contributor.login(), contributor.id(), commentId,
				agreementRef, null, null);
	}

	public RepositoryRef repositoryRef() {
		return RepositoryRef.parse(repository);
	}

}
