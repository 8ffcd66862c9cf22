package org.springaicommunity.clabot;

import org.jspecify.annotations.Nullable;

/**
 * Thrown when a call to the agreement service fails, either on the network or with a
 * non-2xx response.
 */
public class AgreementServiceException extends RuntimeException {

	private final int statusCode;

	private final @Nullable String responseBody;

	public AgreementServiceException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public AgreementServiceException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	/**
	 * HTTP status of the failed response, or -1 when no response was received.
	 */
	public int getStatusCode() {
		return statusCode;
	}

	public @Nullable String getResponseBody() {
		return responseBody;
	}

	public boolean isNotFound() {
		return statusCode == 404;
	}

}
