package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

/**
 * An agreement lifecycle event, decoded from the Concord webhook payload.
 *
 * @param kind the event kind
 * @param eventName the raw Concord event name
 * @param eventId the Concord event id
 * @param agreementRef the agreement the event is about
 * @param signedAgreementRef the signed agreement reference, when a negotiation produced a
 * new one
 * @param signerEmail email of the user who triggered the event, if present
 */
public record AgreementEvent(AgreementEventKind kind, String eventName, @Nullable String eventId,
		String agreementRef, @Nullable String signedAgreementRef, @Nullable String signerEmail) {
}
