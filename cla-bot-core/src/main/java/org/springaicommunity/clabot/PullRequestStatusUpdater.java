package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the terminal CLA states to a pull request: commit status plus labels.
 *
 * <p>
 * The commit status is what blocks or unblocks a merge, so status failures propagate.
 * Label failures are logged and do not stop the update.
 */
public class PullRequestStatusUpdater {

	private static final Logger logger = LoggerFactory.getLogger(PullRequestStatusUpdater.class);

	private final PlatformClient platform;

	private final ClaProperties properties;

	public PullRequestStatusUpdater(PlatformClient platform, ClaProperties properties) {
		this.platform = platform;
		this.properties = properties;
	}

	public void markExempt(long installationId, RepositoryRef repository, int number, String headSha,
			ExemptionReason reason) {
		setStatus(installationId, repository, headSha, CommitState.SUCCESS, reason.statusDescription());
		applyLabel(installationId, repository, number, properties.getExemptLabel().toDefinition());
	}

	/**
	 * Success status, pending label removed, signed label applied.
	 */
	public void markSuccess(long installationId, RepositoryRef repository, int number, String headSha) {
		setStatus(installationId, repository, headSha, CommitState.SUCCESS, ClaComments.STATUS_SIGNED);
		removeLabel(installationId, repository, number, properties.getPendingLabel().getName());
		applyLabel(installationId, repository, number, properties.getSignedLabel().toDefinition());
	}

	public void markPending(long installationId, RepositoryRef repository, String headSha) {
		setStatus(installationId, repository, headSha, CommitState.PENDING, ClaComments.STATUS_PENDING);
	}

	public void applyPendingLabel(long installationId, RepositoryRef repository, int number) {
		applyLabel(installationId, repository, number, properties.getPendingLabel().toDefinition());
	}

	private void setStatus(long installationId, RepositoryRef repository, String headSha, CommitState state,
			String description) {
		platform.createCommitStatus(installationId, repository, headSha,
				new CommitStatus(state, properties.getStatusContext(), description, targetUrl()));
	}

	private void applyLabel(long installationId, RepositoryRef repository, int number, LabelDefinition label) {
		try {
			platform.ensureLabel(installationId, repository, label);
			platform.addLabel(installationId, repository, number, label.name());
		}
		catch (RuntimeException e) {
			logger.warn("Could not apply label '{}' to {}#{}: {}", label.name(), repository, number, e.getMessage());
		}
	}

	private void removeLabel(long installationId, RepositoryRef repository, int number, String label) {
		try {
			if (!platform.removeLabel(installationId, repository, number, label)) {
				logger.debug("Label '{}' was not on {}#{}", label, repository, number);
			}
		}
		catch (RuntimeException e) {
			logger.warn("Could not remove label '{}' from {}#{}: {}", label, repository, number, e.getMessage());
		}
	}

	private @Nullable String targetUrl() {
		String url = properties.getStatusTargetUrl();
		return url == null || url.isBlank() ? null : url;
	}

}
