package org.springaicommunity.clabot;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Picks the email address a contributor's agreement is sent to.
 *
 * <p>
 * Order of preference: the first commit author email that is not on GitHub's private
 * email relay, then the first commit email of any kind, then the public profile email,
 * then a placeholder address built from user id and login. The result depends only on
 * its inputs, so repeated classification of the same pull request is stable.
 */
public class ContributorEmailResolver {

	private final String noreplyDomain;

	public ContributorEmailResolver(String noreplyDomain) {
		this.noreplyDomain = noreplyDomain.toLowerCase(Locale.ROOT);
	}

	/**
	 * Resolve the contributor email.
	 * @param commitEmails commit author emails in commit order
	 * @param publicEmail looked up only when no commit email is usable
	 * @param contributor the pull request author
	 * @return the email to use
	 */
	public String resolve(List<String> commitEmails, Supplier<Optional<String>> publicEmail,
			Contributor contributor) {
		Optional<String> firstReal = commitEmails.stream().filter(email -> !isRelayed(email)).findFirst();
		if (firstReal.isPresent()) {
			return firstReal.get();
		}
		if (!commitEmails.isEmpty()) {
			return commitEmails.get(0);
		}
		return publicEmail.get().orElseGet(() -> placeholder(contributor));
	}

	/**
	 * The relay address GitHub would use for the contributor.
	 */
	public String placeholder(Contributor contributor) {
		return contributor.id() + "+" + contributor.login() + "@" + noreplyDomain;
	}

	boolean isRelayed(String email) {
		String lower = email.toLowerCase(Locale.ROOT);
		return lower.endsWith("@" + noreplyDomain) || lower.endsWith("@noreply.github.com");
	}

}
