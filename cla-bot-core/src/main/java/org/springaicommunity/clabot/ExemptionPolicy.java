package org.springaicommunity.clabot;

import java.util.Optional;

/**
 * Decides whether a contributor needs to sign at all. Allow-listed logins are matched
 * ignoring case and win over the organization membership lookup, which is skipped when
 * disabled.
 */
public class ExemptionPolicy {

	private final PlatformClient platform;

	private final ClaProperties properties;

	public ExemptionPolicy(PlatformClient platform, ClaProperties properties) {
		this.platform = platform;
		this.properties = properties;
	}

	public Optional<ExemptionReason> check(long installationId, RepositoryRef repository, String login) {
		if (properties.isExempted(login)) {
			return Optional.of(ExemptionReason.ALLOW_LISTED);
		}
		if (!properties.isSkipOrgMemberCheck()
				&& platform.isOrganizationMember(installationId, repository.owner(), login)) {
			return Optional.of(ExemptionReason.ORGANIZATION_MEMBER);
		}
		return Optional.empty();
	}

}
