package org.springaicommunity.clabot;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Configuration properties for the CLA check itself.
 *
 * <p>
 * Properties can be set directly via setters, bound by Spring Boot under the
 * {@code cla-bot.cla} prefix, or passed to {@link ClaBotBuilder}. Defaults are suitable
 * for most organizations; at minimum configure the exempted users.
 */
public class ClaProperties {

	/**
	 * GitHub logins that never need to sign (compared case-insensitively).
	 */
	private List<String> exemptedUsers = new ArrayList<>();

	/**
	 * Skip the organization membership exemption.
	 */
	private boolean skipOrgMemberCheck = false;

	/**
	 * Commit status context the bot reports under.
	 */
	private String statusContext = "cla/signature";

	/**
	 * Optional link attached to commit statuses (e.g. a page explaining the CLA).
	 */
	private String statusTargetUrl = "";

	/**
	 * Name used in comments when referring to the organization.
	 */
	private String organizationName = "the project";

	/**
	 * Domain of GitHub's private email relay, also used for placeholder emails.
	 */
	private String noreplyEmailDomain = "users.noreply.github.com";

	private LabelSettings pendingLabel = new LabelSettings("cla:pending", "fbca04", "CLA signature required");

	private LabelSettings signedLabel = new LabelSettings("cla:signed", "0e8a16", "CLA has been signed");

	private LabelSettings exemptLabel = new LabelSettings("cla:exempt", "5319e7", "CLA not required");

	/**
	 * Whether a login is on the exemption list.
	 * @param login GitHub login, any casing
	 * @return true if the login is exempted
	 */
	public boolean isExempted(String login) {
		String normalized = login.trim().toLowerCase(Locale.ROOT);
		for (String user : exemptedUsers) {
			if (user != null && user.trim().toLowerCase(Locale.ROOT).equals(normalized)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Check the properties are usable.
	 * @throws IllegalStateException if a required setting is missing
	 */
	public void validate() {
		if (statusContext == null || statusContext.isBlank()) {
			throw new IllegalStateException("cla-bot.cla.status-context must not be blank");
		}
		if (noreplyEmailDomain == null || noreplyEmailDomain.isBlank()) {
			throw new IllegalStateException("cla-bot.cla.noreply-email-domain must not be blank");
		}
		pendingLabel.validate("pending-label");
		signedLabel.validate("signed-label");
		exemptLabel.validate("exempt-label");
	}

	public List<String> getExemptedUsers() {
		return exemptedUsers;
	}

	public void setExemptedUsers(List<String> exemptedUsers) {
		this.exemptedUsers = exemptedUsers != null ? new ArrayList<>(exemptedUsers) : new ArrayList<>();
	}

	public boolean isSkipOrgMemberCheck() {
		return skipOrgMemberCheck;
	}

	public void setSkipOrgMemberCheck(boolean skipOrgMemberCheck) {
		this.skipOrgMemberCheck = skipOrgMemberCheck;
	}

	public String getStatusContext() {
		return statusContext;
	}

	public void setStatusContext(String statusContext) {
		this.statusContext = statusContext;
	}

	public String getStatusTargetUrl() {
		return statusTargetUrl;
	}

	public void setStatusTargetUrl(String statusTargetUrl) {
		this.statusTargetUrl = statusTargetUrl != null ? statusTargetUrl : "";
	}

	public String getOrganizationName() {
		return organizationName;
	}

	public void setOrganizationName(String organizationName) {
		this.organizationName = organizationName;
	}

	public String getNoreplyEmailDomain() {
		return noreplyEmailDomain;
	}

	public void setNoreplyEmailDomain(String noreplyEmailDomain) {
		this.noreplyEmailDomain = noreplyEmailDomain;
	}

	public LabelSettings getPendingLabel() {
		return pendingLabel;
	}

	public void setPendingLabel(LabelSettings pendingLabel) {
		this.pendingLabel = pendingLabel;
	}

	public LabelSettings getSignedLabel() {
		return signedLabel;
	}

	public void setSignedLabel(LabelSettings signedLabel) {
		this.signedLabel = signedLabel;
	}

	public LabelSettings getExemptLabel() {
		return exemptLabel;
	}

	public void setExemptLabel(LabelSettings exemptLabel) {
		this.exemptLabel = exemptLabel;
	}

	/**
	 * Mutable label settings for property binding.
	 */
	public static class LabelSettings {

		private String name;

		private String color;

		private String description;

		public LabelSettings() {
			this("", "ededed", "");
		}

		public LabelSettings(String name, String color, String description) {
			this.name = name;
			this.color = color;
			this.description = description;
		}

		public LabelDefinition toDefinition() {
			return new LabelDefinition(name, color, description);
		}

		void validate(String key) {
			if (name == null || name.isBlank()) {
				throw new IllegalStateException("cla-bot.cla." + key + ".name must not be blank");
			}
		}

		public String getName() {
			return name;
		}

		public void setName(String name) {
			this.name = name;
		}

		public String getColor() {
			return color;
		}

		public void setColor(String color) {
			this.color = color;
		}

		public String getDescription() {
			return description;
		}

		public void setDescription(String description) {
			this.description = description;
		}

	}

}
