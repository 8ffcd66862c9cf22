package org.springaicommunity.clabot;

/**
 * What the agreement service needs to prepare a CLA for one contributor.
 *
 * @param email address the signing invitation is sent to
 * @param name contributor display name
 * @param username GitHub login
 * @param origin pull request that triggered the request ("owner/repo#number")
 */
public record AgreementRequest(String email, String name, String username, String origin) {

	public static AgreementRequest of(Contributor contributor, String email, RepositoryRef repository, int number) {
		return new AgreementRequest(email, contributor.displayName(), contributor.login(),
				repository.fullName() + "#" + number);
	}

}
