package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

/**
 * The GitHub user who authored a pull request.
 *
 * @param id the GitHub user id (canonical identity)
 * @param login the GitHub username (case-insensitive alias)
 * @param name the display name, if the profile has one
 */
public record Contributor(long id, String login, @Nullable String name) {

	/**
	 * Name to address the contributor with in agreements and invitations.
	 * @return the display name, or the login when no name is set
	 */
	public String displayName() {
		return name != null && !name.isBlank() ? name : login;
	}

}
