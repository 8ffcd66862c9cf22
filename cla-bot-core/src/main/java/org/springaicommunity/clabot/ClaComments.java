package org.springaicommunity.clabot;

/**
 * Markdown bodies of the comments the bot posts, and the commit status descriptions.
 */
public class ClaComments {

	public static final String RESEND_COMMAND = "/cla resend";

	static final String STATUS_PENDING = "CLA signature required";

	static final String STATUS_SIGNED = "CLA has been signed";

	private static final String HEADER = "## Contributor License Agreement\n\n";

	private final String organizationName;

	public ClaComments(String organizationName) {
		this.organizationName = organizationName;
	}

	public String pending(String username) {
		return HEADER + "Hey @" + username + "!\n\n" + "Thank you for your contribution to " + organizationName
				+ "! Before we can merge this pull request, we need you to sign our Contributor License Agreement (CLA).\n\n"
				+ "### How to sign\n\n" + "1. **Check your email** for an invitation to sign the CLA\n"
				+ "2. Click the signing link in the email to review and sign the document\n"
				+ "3. Once signed, this comment will be updated automatically\n\n"
				+ "> :email: If you don't see the invitation, check your spam folder or comment `" + RESEND_COMMAND
				+ "` to receive it again.\n\n" + "---\n\n" + ":x: **CLA not signed yet**\n\n" + footer();
	}

	public String signed(String username) {
		return HEADER + "Hey @" + username + "!\n\n" + ":green_heart: **CLA has been signed**\n\n"
				+ "Thank you for signing the Contributor License Agreement! Your pull request can now be reviewed and merged.\n\n"
				+ "---\n\n" + footer();
	}

	public String creationFailed(String username) {
		return HEADER + "Hey @" + username + "!\n\n"
				+ "We need you to sign our CLA before we can merge this pull request. Unfortunately, there was an issue "
				+ "creating your agreement automatically.\n\n" + "Please contact the maintainers for assistance.\n\n"
				+ "---\n\n" + ":x: **CLA not signed yet**";
	}

	public String alreadySigned(String requester) {
		return "@" + requester + " the CLA for this pull request has already been signed, no resend is needed.";
	}

	public String notRequired(String requester, String author) {
		return "@" + requester + " @" + author + " does not need to sign the CLA, no invitation was sent.";
	}

	public String invitationResent(String requester, String email) {
		return "@" + requester + " the CLA signing invitation has been sent again to " + mask(email) + ".";
	}

	public String newInvitationSent(String requester, String email) {
		return "@" + requester + " a new CLA signing invitation has been sent to " + mask(email) + ".";
	}

	public String resendFailed(String requester) {
		return "@" + requester + " the CLA invitation could not be sent. Please contact the maintainers for assistance.";
	}

	private String footer() {
		return "<sub>This is an automated message from the " + organizationName + " CLA bot.</sub>";
	}

	/**
	 * Hide the local part of an email in public comments, keeping its first character.
	 */
	static String mask(String email) {
		int at = email.indexOf('@');
		if (at <= 1) {
			return email;
		}
		return email.charAt(0) + "***" + email.substring(at);
	}

}
