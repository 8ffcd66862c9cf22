package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

/**
 * A commit status to report on a pull request's head commit.
 *
 * @param state success or pending
 * @param context status context shown in the checks list
 * @param description short human-readable explanation
 * @param targetUrl link behind the status, if any
 */
public record CommitStatus(CommitState state, String context, String description, @Nullable String targetUrl) {

}
