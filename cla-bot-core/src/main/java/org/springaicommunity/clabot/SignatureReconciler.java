package org.springaicommunity.clabot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Brings a pull request's CLA check to a consistent state after a pull request event.
 *
 * <p>
 * The contributor is classified in a fixed order, first match wins:
 * <ol>
 * <li>allow-listed login (case-insensitive): exempt</li>
 * <li>member of the owning organization, unless the check is disabled: exempt</li>
 * <li>signed agreement on record: success</li>
 * <li>pull request already tracked and agreement pending: pending status refreshed</li>
 * <li>signed agreement found in the agreement service: recorded, then success</li>
 * <li>otherwise: a new agreement is requested</li>
 * </ol>
 * Each step writes to the record store before the next event can observe it, so a
 * repeated {@code opened} or a {@code synchronize} lands on step 4 and posts nothing new.
 */
public class SignatureReconciler {

	private static final Logger logger = LoggerFactory.getLogger(SignatureReconciler.class);

	private final AgreementRecordRepository records;

	private final PlatformClient platform;

	private final AgreementClient agreements;

	private final PullRequestStatusUpdater statusUpdater;

	private final ExemptionPolicy exemptions;

	private final ContributorEmailResolver emailResolver;

	private final ClaComments comments;

	private final Clock clock;

	public SignatureReconciler(AgreementRecordRepository records, PlatformClient platform, AgreementClient agreements,
			ClaProperties properties) {
		this(records, platform, agreements, properties, Clock.systemUTC());
	}

	public SignatureReconciler(AgreementRecordRepository records, PlatformClient platform, AgreementClient agreements,
			ClaProperties properties, Clock clock) {
		this.records = records;
		this.platform = platform;
		this.agreements = agreements;
		this.clock = clock;
		this.statusUpdater = new PullRequestStatusUpdater(platform, properties);
		this.exemptions = new ExemptionPolicy(platform, properties);
		this.emailResolver = new ContributorEmailResolver(properties.getNoreplyEmailDomain());
		this.comments = new ClaComments(properties.getOrganizationName());
	}

	/**
	 * Reconcile one pull request event.
	 * @param event the decoded event
	 * @return the state the pull request was brought to
	 */
	public ReconciliationOutcome reconcile(PullRequestEvent event) {
		return switch (event.action()) {
			case OPENED, SYNCHRONIZE, REOPENED -> classify(event);
			case CLOSED, EDITED, OTHER -> {
				logger.debug("Ignoring {} action on {}#{}", event.action(), event.repository(), event.number());
				yield ReconciliationOutcome.IGNORED;
			}
		};
	}

	private ReconciliationOutcome classify(PullRequestEvent event) {
		Contributor contributor = event.contributor();
		RepositoryRef repository = event.repository();
		long installationId = event.installationId();
		logger.info("Processing {} of {}#{} by {} ({})", event.action(), repository, event.number(),
				contributor.login(), event.headSha());

		Optional<ExemptionReason> exemption = exemptions.check(installationId, repository, contributor.login());
		if (exemption.isPresent()) {
			logger.info("{} is exempt ({}), CLA not required", contributor.login(), exemption.get());
			statusUpdater.markExempt(installationId, repository, event.number(), event.headSha(), exemption.get());
			return ReconciliationOutcome.EXEMPT;
		}

		Optional<ContributorAgreement> existing = records.findAgreementByUserId(contributor.id());
		if (existing.isPresent() && existing.get().isSigned()) {
			logger.info("{} has already signed the CLA ({})", contributor.login(), existing.get().agreementRef());
			statusUpdater.markSuccess(installationId, repository, event.number(), event.headSha());
			return ReconciliationOutcome.SIGNED;
		}

		Optional<TrackedPullRequest> tracked = records.findTrackedPullRequest(repository.fullName(), event.number(),
				contributor.id());
		if (tracked.isPresent() && existing.isPresent() && existing.get().isPending()) {
			logger.info("Agreement {} already requested for {}#{}, refreshing status", existing.get().agreementRef(),
					repository, event.number());
			statusUpdater.markPending(installationId, repository, event.headSha());
			return ReconciliationOutcome.PENDING_REFRESHED;
		}

		String email = resolveEmail(installationId, repository, event.number(), contributor);

		Optional<AgreementSummary> external = agreements.findCurrentAgreementByEmail(email);
		if (external.isPresent()) {
			AgreementSummary agreement = external.get();
			Instant signedAt = agreement.signedAt() != null ? agreement.signedAt() : clock.instant();
			records.upsertAgreement(
					ContributorAgreement.signed(contributor, email, agreement.agreementRef(), signedAt));
			logger.info("Found signed agreement {} for {}, recorded it", agreement.agreementRef(), contributor.login());
			statusUpdater.markSuccess(installationId, repository, event.number(), event.headSha());
			return ReconciliationOutcome.SIGNED_EXTERNALLY;
		}

		return requestAgreement(event, email);
	}

	private ReconciliationOutcome requestAgreement(PullRequestEvent event, String email) {
		Contributor contributor = event.contributor();
		RepositoryRef repository = event.repository();
		long installationId = event.installationId();

		String agreementRef;
		try {
			agreementRef = agreements
				.createAgreement(AgreementRequest.of(contributor, email, repository, event.number()));
		}
		catch (AgreementServiceException e) {
			logger.error("Failed to create agreement for {} on {}#{} (status {}): {}", contributor.login(), repository,
					event.number(), e.getStatusCode(), e.getMessage(), e);
			statusUpdater.applyPendingLabel(installationId, repository, event.number());
			statusUpdater.markPending(installationId, repository, event.headSha());
			platform.createComment(installationId, repository, event.number(),
					comments.creationFailed(contributor.login()));
			return ReconciliationOutcome.AGREEMENT_FAILED;
		}

		records.upsertAgreement(ContributorAgreement.pending(contributor, email, agreementRef));
		records.upsertTrackedPullRequest(
				TrackedPullRequest.of(repository, event.number(), contributor, null, agreementRef));

		statusUpdater.applyPendingLabel(installationId, repository, event.number());
		long commentId = platform.createComment(installationId, repository, event.number(),
				comments.pending(contributor.login()));
		records.updateTrackedCommentId(repository.fullName(), event.number(), contributor.id(), commentId);
		statusUpdater.markPending(installationId, repository, event.headSha());

		logger.info("Requested agreement {} for {} on {}#{}", agreementRef, contributor.login(), repository,
				event.number());
		return ReconciliationOutcome.AGREEMENT_REQUESTED;
	}

	private String resolveEmail(long installationId, RepositoryRef repository, int number, Contributor contributor) {
		List<String> commitEmails = platform.listCommitAuthorEmails(installationId, repository, number);
		String email = emailResolver.resolve(commitEmails,
				() -> platform.getPublicEmail(installationId, contributor.login()), contributor);
		logger.debug("Resolved email for {}: {}", contributor.login(), email);
		return email;
	}

}
