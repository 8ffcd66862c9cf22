package org.springaicommunity.clabot;

/**
 * A GitHub repository identified by owner and name.
 *
 * @param owner the owning user or organization login
 * @param name the repository name
 */
public record RepositoryRef(String owner, String name) {

	/**
	 * Parse an "owner/repo" full name.
	 * @param fullName repository full name
	 * @return repository reference
	 * @throws IllegalArgumentException if the name is not in "owner/repo" form
	 */
	public static RepositoryRef parse(String fullName) {
		int slash = fullName.indexOf('/');
		if (slash <= 0 || slash == fullName.length() - 1 || fullName.indexOf('/', slash + 1) >= 0) {
			throw new IllegalArgumentException("Repository must be in 'owner/repo' format: " + fullName);
		}
		return new RepositoryRef(fullName.substring(0, slash), fullName.substring(slash + 1));
	}

	public String fullName() {
		return owner + "/" + name;
	}

	@Override
	public String toString() {
		return fullName();
	}

}
