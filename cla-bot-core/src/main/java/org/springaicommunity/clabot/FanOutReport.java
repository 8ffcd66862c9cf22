package org.springaicommunity.clabot;

import java.util.List;

/**
 * Result of replaying a signature onto a contributor's tracked pull requests.
 *
 * @param agreementRef agreement that was signed, or empty when nothing transitioned
 * @param transitioned whether this event moved the agreement to signed
 * @param updated pull requests updated successfully
 * @param skipped pull requests whose repository no installation can access
 * @param failed pull requests ("owner/repo#number") whose update failed
 */
public record FanOutReport(String agreementRef, boolean transitioned, int updated, int skipped, List<String> failed) {

	/**
	 * Report for an event that changed nothing.
	 */
	public static FanOutReport none(String agreementRef) {
		return new FanOutReport(agreementRef, false, 0, 0, List.of());
	}

	public int total() {
		return updated + skipped + failed.size();
	}

}
