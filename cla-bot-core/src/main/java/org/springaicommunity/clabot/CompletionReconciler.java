package org.springaicommunity.clabot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies agreement-service events to the record store and, when a contributor signs,
 * replays the signed state onto every pull request tracked for them, across repositories.
 *
 * <p>
 * Pull requests are updated independently: a failure on one is logged and counted, and
 * the others are still updated. A second signature event for an agreement already
 * recorded as signed changes nothing.
 */
public class CompletionReconciler {

	private static final Logger logger = LoggerFactory.getLogger(CompletionReconciler.class);

	private final AgreementRecordRepository records;

	private final PlatformClient platform;

	private final PullRequestStatusUpdater statusUpdater;

	private final ClaComments comments;

	private final Clock clock;

	public CompletionReconciler(AgreementRecordRepository records, PlatformClient platform, ClaProperties properties) {
		this(records, platform, properties, Clock.systemUTC());
	}

	public CompletionReconciler(AgreementRecordRepository records, PlatformClient platform, ClaProperties properties,
			Clock clock) {
		this.records = records;
		this.platform = platform;
		this.clock = clock;
		this.statusUpdater = new PullRequestStatusUpdater(platform, properties);
		this.comments = new ClaComments(properties.getOrganizationName());
	}

	/**
	 * Handle one agreement event.
	 * @param event the decoded event
	 * @return what the event changed
	 */
	public FanOutReport handle(AgreementEvent event) {
		return switch (event.kind()) {
			case EXECUTED, NEW_SIGNATURE -> signed(event);
			case CANCELLED -> {
				if (records.updateStatus(event.agreementRef(), ClaStatus.CANCELLED)) {
					logger.info("Agreement {} cancelled", event.agreementRef());
				}
				else {
					logger.warn("No CLA record for cancelled agreement {}", event.agreementRef());
				}
				yield FanOutReport.none(event.agreementRef());
			}
			case MOVED_TO_SIGNING -> {
				logger.info("Agreement {} moved to signing", event.agreementRef());
				yield FanOutReport.none(event.agreementRef());
			}
			case UNSUPPORTED -> {
				logger.debug("Ignoring agreement event {} for {}", event.eventName(), event.agreementRef());
				yield FanOutReport.none(event.agreementRef());
			}
		};
	}

	private FanOutReport signed(AgreementEvent event) {
		Optional<ContributorAgreement> found = records.findAgreementByReference(event.agreementRef());
		if (found.isEmpty() && event.signedAgreementRef() != null
				&& !event.signedAgreementRef().equals(event.agreementRef())) {
			found = records.findAgreementByReference(event.signedAgreementRef());
		}
		if (found.isEmpty()) {
			logger.warn("No CLA record for agreement {} (signed reference {}), ignoring {}", event.agreementRef(),
					event.signedAgreementRef(), event.eventName());
			return FanOutReport.none(event.agreementRef());
		}

		ContributorAgreement agreement = found.get();
		if (agreement.isSigned()) {
			logger.info("Agreement {} already recorded as signed, ignoring {}", agreement.agreementRef(),
					event.eventName());
			return FanOutReport.none(agreement.agreementRef());
		}

		records.markSigned(agreement.agreementRef(), clock.instant());
		logger.info("{} signed agreement {}", agreement.username(), agreement.agreementRef());

		return fanOut(agreement);
	}

	private FanOutReport fanOut(ContributorAgreement agreement) {
		List<TrackedPullRequest> trackedPullRequests = records.findTrackedPullRequestsByUserId(agreement.userId());
		if (trackedPullRequests.isEmpty()) {
			logger.info("No tracked pull requests for {}", agreement.username());
		}

		InstallationLocator installations = new InstallationLocator();
		int updated = 0;
		int skipped = 0;
		List<String> failed = new ArrayList<>();
		for (TrackedPullRequest tracked : trackedPullRequests) {
			String label = tracked.repository() + "#" + tracked.number();
			try {
				Optional<Long> installationId = installations.find(tracked.repository());
				if (installationId.isEmpty()) {
					logger.warn("No installation can access {}, skipping {}", tracked.repository(), label);
					skipped++;
					continue;
				}
				updatePullRequest(installationId.get(), tracked, agreement.username());
				updated++;
			}
			catch (RuntimeException e) {
				logger.error("Failed to update {} after signature of {}: {}", label, agreement.agreementRef(),
						e.getMessage(), e);
				failed.add(label);
			}
		}
		logger.info("Updated {}/{} pull requests of {} ({} skipped, {} failed)", updated, trackedPullRequests.size(),
				agreement.username(), skipped, failed.size());
		return new FanOutReport(agreement.agreementRef(), true, updated, skipped, List.copyOf(failed));
	}

	private void updatePullRequest(long installationId, TrackedPullRequest tracked, String username) {
		RepositoryRef repository = tracked.repositoryRef();
		PullRequestDetails pullRequest = platform.getPullRequest(installationId, repository, tracked.number());

		if (tracked.commentId() != null) {
			try {
				platform.updateComment(installationId, repository, tracked.commentId(), comments.signed(username));
			}
			catch (RuntimeException e) {
				logger.warn("Could not update comment {} on {}#{}: {}", tracked.commentId(), repository,
						tracked.number(), e.getMessage());
			}
		}

		statusUpdater.markSuccess(installationId, repository, tracked.number(), pullRequest.headSha());
	}

	/**
	 * Finds the installation with access to a repository, scanning each installation's
	 * repository list at most once per fan-out.
	 */
	private final class InstallationLocator {

		private final Map<String, Long> repositoryInstallations = new HashMap<>();

		private final List<Long> pending = new ArrayList<>();

		private boolean listed;

		Optional<Long> find(String repository) {
			if (!listed) {
				pending.addAll(platform.listInstallationIds());
				listed = true;
			}
			while (!repositoryInstallations.containsKey(repository) && !pending.isEmpty()) {
				long installationId = pending.remove(0);
				try {
					for (RepositoryRef accessible : platform.listInstallationRepositories(installationId)) {
						repositoryInstallations.putIfAbsent(accessible.fullName(), installationId);
					}
				}
				catch (RuntimeException e) {
					logger.debug("Could not list repositories of installation {}: {}", installationId,
							e.getMessage());
				}
			}
			return Optional.ofNullable(repositoryInstallations.get(repository));
		}

	}

}
