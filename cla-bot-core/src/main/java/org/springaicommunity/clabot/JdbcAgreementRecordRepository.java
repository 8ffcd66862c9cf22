package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * {@link AgreementRecordRepository} backed by a relational database through Spring's
 * {@link JdbcTemplate}.
 *
 * <p>
 * Upserts update first and insert when nothing matched. An insert that loses a race
 * against a concurrent insert of the same key hits the unique constraint and is retried
 * as an update, so the database stays the only serialization point.
 */
public class JdbcAgreementRecordRepository implements AgreementRecordRepository {

	private static final Logger logger = LoggerFactory.getLogger(JdbcAgreementRecordRepository.class);

	private static final String AGREEMENT_COLUMNS = "github_username, github_user_id, github_email, agreement_ref, "
			+ "status, signed_at, created_at, updated_at";

	private static final String TRACKED_COLUMNS = "repo_full_name, pr_number, github_username, github_user_id, "
			+ "comment_id, agreement_ref, created_at, updated_at";

	private static final RowMapper<ContributorAgreement> AGREEMENT_MAPPER = (rs, rowNum) -> new ContributorAgreement(
			rs.getString("github_username"), rs.getLong("github_user_id"), rs.getString("github_email"),
			rs.getString("agreement_ref"), ClaStatus.fromValue(rs.getString("status")), toInstant(rs, "signed_at"),
			toInstant(rs, "created_at"), toInstant(rs, "updated_at"));

	private static final RowMapper<TrackedPullRequest> TRACKED_MAPPER = (rs, rowNum) -> new TrackedPullRequest(
			rs.getString("repo_full_name"), rs.getInt("pr_number"), rs.getString("github_username"),
			rs.getLong("github_user_id"), nullableLong(rs, "comment_id"), rs.getString("agreement_ref"),
			toInstant(rs, "created_at"), toInstant(rs, "updated_at"));

	private final JdbcTemplate jdbcTemplate;

	private final Clock clock;

	public JdbcAgreementRecordRepository(JdbcTemplate jdbcTemplate) {
		this(jdbcTemplate, Clock.systemUTC());
	}

	public JdbcAgreementRecordRepository(JdbcTemplate jdbcTemplate, Clock clock) {
		this.jdbcTemplate = jdbcTemplate;
		this.clock = clock;
	}

	// ========== Contributor agreements ==========

	@Override
	public Optional<ContributorAgreement> findAgreementByUserId(long userId) {
		return queryOne("SELECT " + AGREEMENT_COLUMNS + " FROM contributor_agreements WHERE github_user_id = ?",
				AGREEMENT_MAPPER, userId);
	}

	@Override
	public Optional<ContributorAgreement> findAgreementByReference(String agreementRef) {
		return queryOne("SELECT " + AGREEMENT_COLUMNS + " FROM contributor_agreements WHERE agreement_ref = ?",
				AGREEMENT_MAPPER, agreementRef);
	}

	@Override
	public ContributorAgreement upsertAgreement(ContributorAgreement agreement) {
		Timestamp now = now();
		if (updateAgreement(agreement, now) == 0) {
			try {
				jdbcTemplate.update("INSERT INTO contributor_agreements (" + AGREEMENT_COLUMNS
						+ ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)", agreement.username(), agreement.userId(),
						agreement.email(), agreement.agreementRef(), agreement.status().value(),
						toTimestamp(agreement.signedAt()), now, now);
			}
			catch (DuplicateKeyException e) {
				logger.debug("Concurrent insert for user {}, updating instead", agreement.userId());
				updateAgreement(agreement, now);
			}
		}
		return findAgreementByUserId(agreement.userId())
			.orElseThrow(() -> new IllegalStateException("Agreement for user " + agreement.userId() + " not stored"));
	}

	private int updateAgreement(ContributorAgreement agreement, Timestamp now) {
		return jdbcTemplate.update("UPDATE contributor_agreements SET github_username = ?, "
				+ "github_email = COALESCE(?, github_email), agreement_ref = ?, status = ?, signed_at = ?, "
				+ "updated_at = ? WHERE github_user_id = ?", agreement.username(), agreement.email(),
				agreement.agreementRef(), agreement.status().value(), toTimestamp(agreement.signedAt()), now,
				agreement.userId());
	}

	@Override
	public boolean markSigned(String agreementRef, Instant signedAt) {
		return jdbcTemplate.update(
				"UPDATE contributor_agreements SET status = ?, signed_at = ?, updated_at = ? WHERE agreement_ref = ?",
				ClaStatus.SIGNED.value(), Timestamp.from(signedAt), now(), agreementRef) > 0;
	}

	@Override
	public boolean updateStatus(String agreementRef, ClaStatus status) {
		return jdbcTemplate.update("UPDATE contributor_agreements SET status = ?, updated_at = ? WHERE agreement_ref = ?",
				status.value(), now(), agreementRef) > 0;
	}

	@Override
	public boolean deleteAgreement(long userId) {
		return jdbcTemplate.update("DELETE FROM contributor_agreements WHERE github_user_id = ?", userId) > 0;
	}

	// ========== Tracked pull requests ==========

	@Override
	public Optional<TrackedPullRequest> findTrackedPullRequest(String repository, int number, long userId) {
		return queryOne("SELECT " + TRACKED_COLUMNS + " FROM tracked_pull_requests "
				+ "WHERE repo_full_name = ? AND pr_number = ? AND github_user_id = ?", TRACKED_MAPPER, repository,
				number, userId);
	}

	@Override
	public List<TrackedPullRequest> findTrackedPullRequestsByUserId(long userId) {
		return jdbcTemplate.query("SELECT " + TRACKED_COLUMNS
				+ " FROM tracked_pull_requests WHERE github_user_id = ? ORDER BY repo_full_name, pr_number",
				TRACKED_MAPPER, userId);
	}

	@Override
	public TrackedPullRequest upsertTrackedPullRequest(TrackedPullRequest tracked) {
		Timestamp now = now();
		if (updateTracked(tracked, now) == 0) {
			try {
				jdbcTemplate.update("INSERT INTO tracked_pull_requests (" + TRACKED_COLUMNS
						+ ") VALUES (?, ?, ?, ?, ?, ?, ?, ?)", tracked.repository(), tracked.number(),
						tracked.username(), tracked.userId(), tracked.commentId(), tracked.agreementRef(), now, now);
			}
			catch (DuplicateKeyException e) {
				logger.debug("Concurrent insert for {}#{} (user {}), updating instead", tracked.repository(),
						tracked.number(), tracked.userId());
				updateTracked(tracked, now);
			}
		}
		return findTrackedPullRequest(tracked.repository(), tracked.number(), tracked.userId())
			.orElseThrow(() -> new IllegalStateException(
					"Tracked pull request " + tracked.repository() + "#" + tracked.number() + " not stored"));
	}

	private int updateTracked(TrackedPullRequest tracked, Timestamp now) {
		return jdbcTemplate.update("UPDATE tracked_pull_requests SET comment_id = COALESCE(?, comment_id), "
				+ "agreement_ref = COALESCE(?, agreement_ref), updated_at = ? "
				+ "WHERE repo_full_name = ? AND pr_number = ? AND github_user_id = ?", tracked.commentId(),
				tracked.agreementRef(), now, tracked.repository(), tracked.number(), tracked.userId());
	}

	@Override
	public boolean updateTrackedCommentId(String repository, int number, long userId, long commentId) {
		return jdbcTemplate.update("UPDATE tracked_pull_requests SET comment_id = ?, updated_at = ? "
				+ "WHERE repo_full_name = ? AND pr_number = ? AND github_user_id = ?", commentId, now(), repository,
				number, userId) > 0;
	}

	@Override
	public boolean updateTrackedAgreementReference(String repository, int number, long userId,
			String agreementRef) {
		return jdbcTemplate.update("UPDATE tracked_pull_requests SET agreement_ref = ?, updated_at = ? "
				+ "WHERE repo_full_name = ? AND pr_number = ? AND github_user_id = ?", agreementRef, now(),
				repository, number, userId) > 0;
	}

	// ========== Helpers ==========

	private <T> Optional<T> queryOne(String sql, RowMapper<T> mapper, Object... args) {
		List<T> results = jdbcTemplate.query(sql, mapper, args);
		return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
	}

	private Timestamp now() {
		return Timestamp.from(clock.instant());
	}

	private static @Nullable Timestamp toTimestamp(@Nullable Instant instant) {
		return instant != null ? Timestamp.from(instant) : null;
	}

	private static @Nullable Instant toInstant(ResultSet rs, String column) throws SQLException {
		Timestamp timestamp = rs.getTimestamp(column);
		return timestamp != null ? timestamp.toInstant() : null;
	}

	private static @Nullable Long nullableLong(ResultSet rs, String column) throws SQLException {
		long value = rs.getLong(column);
		return rs.wasNull() ? null : value;
	}

}
