package org.springaicommunity.clabot;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for the bot's persistent state: one {@link ContributorAgreement}
 * per contributor and one {@link TrackedPullRequest} per contributor per pull request.
 *
 * <p>
 * Implementations enforce the uniqueness of both keys and provide the upsert semantics
 * below; concurrent webhooks rely on that instead of in-process locking.
 */
public interface AgreementRecordRepository {

	Optional<ContributorAgreement> findAgreementByUserId(long userId);

	Optional<ContributorAgreement> findAgreementByReference(String agreementRef);

	/**
	 * Insert an agreement, or overwrite reference, status, email, username and signing
	 * time of the existing record for the same user id.
	 * @param agreement the record to store
	 * @return the stored record
	 */
	ContributorAgreement upsertAgreement(ContributorAgreement agreement);

	/**
	 * Mark the agreement with the given reference as signed.
	 * @param agreementRef agreement reference
	 * @param signedAt signing time
	 * @return true if a record was updated
	 */
	boolean markSigned(String agreementRef, Instant signedAt);

	/**
	 * Change the status of the agreement with the given reference, leaving the signing
	 * time untouched.
	 * @param agreementRef agreement reference
	 * @param status new status
	 * @return true if a record was updated
	 */
	boolean updateStatus(String agreementRef, ClaStatus status);

	/**
	 * Delete the agreement record of a contributor.
	 * @param userId GitHub user id
	 * @return true if a record was deleted
	 */
	boolean deleteAgreement(long userId);

	Optional<TrackedPullRequest> findTrackedPullRequest(String repository, int number, long userId);

	/**
	 * All tracked pull requests of a contributor, across repositories.
	 */
	List<TrackedPullRequest> findTrackedPullRequestsByUserId(long userId);

	/**
	 * Insert a tracked pull request, or update the existing row for the same repository,
	 * number and user id. Comment id and agreement reference are only replaced by non-null
	 * values.
	 * @param trackedPullRequest the row to store
	 * @return the stored row
	 */
	TrackedPullRequest upsertTrackedPullRequest(TrackedPullRequest trackedPullRequest);

	boolean updateTrackedCommentId(String repository, int number, long userId, long commentId);

	boolean updateTrackedAgreementReference(String repository, int number, long userId, String agreementRef);

}
