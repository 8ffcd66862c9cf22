package org.springaicommunity.clabot;

/**
 * Thrown when a webhook body cannot be decoded into an event.
 */
public class InvalidWebhookPayloadException extends RuntimeException {

	public InvalidWebhookPayloadException(String message) {
		super(message);
	}

	public InvalidWebhookPayloadException(String message, Throwable cause) {
		super(message, cause);
	}

}
