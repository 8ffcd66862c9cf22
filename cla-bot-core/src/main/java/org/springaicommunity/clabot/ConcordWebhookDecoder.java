package org.springaicommunity.clabot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;

/**
 * Decodes Concord webhook bodies into {@link AgreementEvent}s.
 *
 * <p>
 * Event names outside {@link AgreementEventKind} decode to
 * {@link AgreementEventKind#UNSUPPORTED} and may lack an agreement; the handled kinds
 * require one.
 */
public class ConcordWebhookDecoder {

	private final ObjectMapper objectMapper;

	private final JsonNodeUtils json = new JsonNodeUtils();

	public ConcordWebhookDecoder(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public AgreementEvent decode(byte[] body) {
		JsonNode root;
		try {
			root = objectMapper.readTree(body);
		}
		catch (IOException e) {
			throw new InvalidWebhookPayloadException("Concord webhook body is not valid JSON", e);
		}
		if (root == null || !root.isObject()) {
			throw new InvalidWebhookPayloadException("Concord webhook body is not a JSON object");
		}

		String eventName = json.getString(root, "event_name").orElse("");
		AgreementEventKind kind = AgreementEventKind.fromWireName(eventName);
		JsonNode content = root.path("content");
		String agreementRef = json.getString(content, "agreement", "uid").orElse("");
		if (agreementRef.isEmpty() && kind != AgreementEventKind.UNSUPPORTED) {
			throw new InvalidWebhookPayloadException("Concord " + eventName + " event has no agreement uid");
		}
		return new AgreementEvent(kind, eventName, json.getString(root, "event_id").orElse(null), agreementRef,
				json.getString(content, "agreement", "signedAgreementUid").orElse(null),
				json.getString(content, "user", "email").orElse(null));
	}

}
