package org.springaicommunity.clabot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Optional;

/**
 * Handles the {@code /cla resend} pull request comment.
 *
 * <p>
 * A pending agreement that still exists in the agreement service gets its invitation
 * sent again. When the contributor has no agreement, or it was cancelled, expired or
 * deleted in the agreement service, a new one is created and the pull request is pointed
 * at it. The command acts on the pull request author's agreement, whoever comments. An
 * exempt author only gets a reply; their pull request keeps its exempt status.
 */
public class ResendCommandHandler {

	private static final Logger logger = LoggerFactory.getLogger(ResendCommandHandler.class);

	private final AgreementRecordRepository records;

	private final PlatformClient platform;

	private final AgreementClient agreements;

	private final PullRequestStatusUpdater statusUpdater;

	private final ExemptionPolicy exemptions;

	private final ContributorEmailResolver emailResolver;

	private final ClaComments comments;

	public ResendCommandHandler(AgreementRecordRepository records, PlatformClient platform,
			AgreementClient agreements, ClaProperties properties) {
		this.records = records;
		this.platform = platform;
		this.agreements = agreements;
		this.statusUpdater = new PullRequestStatusUpdater(platform, properties);
		this.exemptions = new ExemptionPolicy(platform, properties);
		this.emailResolver = new ContributorEmailResolver(properties.getNoreplyEmailDomain());
		this.comments = new ClaComments(properties.getOrganizationName());
	}

	/**
	 * Whether a comment body is the resend command: exact match after trimming, ignoring
	 * case.
	 */
	public static boolean isResendCommand(String body) {
		return ClaComments.RESEND_COMMAND.equals(body.trim().toLowerCase(Locale.ROOT));
	}

	/**
	 * Handle a comment event.
	 * @param event the decoded comment event
	 * @return what the command did
	 */
	public ResendOutcome handle(IssueCommentEvent event) {
		if (!event.isNewPullRequestComment() || !isResendCommand(event.body())) {
			return ResendOutcome.IGNORED;
		}
		Contributor author = event.author();
		logger.info("{} requested a CLA resend on {}#{} for {}", event.commenter(), event.repository(),
				event.number(), author.login());

		Optional<ExemptionReason> exemption = exemptions.check(event.installationId(), event.repository(),
				author.login());
		if (exemption.isPresent()) {
			logger.info("{} is exempt ({}), nothing to resend", author.login(), exemption.get());
			reply(event, comments.notRequired(event.commenter(), author.login()));
			return ResendOutcome.EXEMPT;
		}

		Optional<ContributorAgreement> existing = records.findAgreementByUserId(author.id());
		if (existing.isEmpty()) {
			return sendNewAgreement(event);
		}

		ContributorAgreement agreement = existing.get();
		return switch (agreement.status()) {
			case SIGNED -> {
				reply(event, comments.alreadySigned(event.commenter()));
				yield ResendOutcome.ALREADY_SIGNED;
			}
			case PENDING -> resendPending(event, agreement);
			case EXPIRED, CANCELLED -> {
				logger.info("Agreement {} of {} is {}, creating a new one", agreement.agreementRef(), author.login(),
						agreement.status().value());
				yield sendNewAgreement(event);
			}
		};
	}

	private ResendOutcome resendPending(IssueCommentEvent event, ContributorAgreement agreement) {
		Optional<AgreementSummary> remote;
		try {
			remote = agreements.getAgreement(agreement.agreementRef());
		}
		catch (AgreementServiceException e) {
			logger.error("Could not fetch agreement {}: {}", agreement.agreementRef(), e.getMessage(), e);
			reply(event, comments.resendFailed(event.commenter()));
			return ResendOutcome.FAILED;
		}

		if (remote.isEmpty()) {
			logger.info("Agreement {} no longer exists, replacing it", agreement.agreementRef());
			records.deleteAgreement(agreement.userId());
			return sendNewAgreement(event);
		}

		String email = agreement.email() != null ? agreement.email() : emailResolver.placeholder(event.author());
		try {
			agreements.resendInvitation(agreement.agreementRef(), email, event.author().displayName(),
					event.author().login());
		}
		catch (AgreementServiceException e) {
			logger.error("Could not resend agreement {}: {}", agreement.agreementRef(), e.getMessage(), e);
			reply(event, comments.resendFailed(event.commenter()));
			return ResendOutcome.FAILED;
		}
		reply(event, comments.invitationResent(event.commenter(), email));
		return ResendOutcome.INVITATION_RESENT;
	}

	private ResendOutcome sendNewAgreement(IssueCommentEvent event) {
		Contributor author = event.author();
		RepositoryRef repository = event.repository();
		long installationId = event.installationId();

		String email = emailResolver.resolve(
				platform.listCommitAuthorEmails(installationId, repository, event.number()),
				() -> platform.getPublicEmail(installationId, author.login()), author);

		String agreementRef;
		try {
			agreementRef = agreements.createAgreement(AgreementRequest.of(author, email, repository, event.number()));
		}
		catch (AgreementServiceException e) {
			logger.error("Failed to create agreement for {} on {}#{}: {}", author.login(), repository, event.number(),
					e.getMessage(), e);
			reply(event, comments.resendFailed(event.commenter()));
			return ResendOutcome.FAILED;
		}

		records.upsertAgreement(ContributorAgreement.pending(author, email, agreementRef));
		if (!records.updateTrackedAgreementReference(repository.fullName(), event.number(), author.id(),
				agreementRef)) {
			records.upsertTrackedPullRequest(
					TrackedPullRequest.of(repository, event.number(), author, null, agreementRef));
		}

		try {
			PullRequestDetails pullRequest = platform.getPullRequest(installationId, repository, event.number());
			statusUpdater.markPending(installationId, repository, pullRequest.headSha());
		}
		catch (RuntimeException e) {
			logger.warn("Could not set pending status on {}#{} after sending agreement {}: {}", repository,
					event.number(), agreementRef, e.getMessage());
		}

		reply(event, comments.newInvitationSent(event.commenter(), email));
		logger.info("Sent new agreement {} to {} for {}#{}", agreementRef, author.login(), repository,
				event.number());
		return ResendOutcome.NEW_AGREEMENT_SENT;
	}

	private void reply(IssueCommentEvent event, String body) {
		platform.createComment(event.installationId(), event.repository(), event.number(), body);
	}

}
