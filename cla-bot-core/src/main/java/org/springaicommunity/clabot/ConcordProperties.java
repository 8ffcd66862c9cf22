package org.springaicommunity.clabot;

import java.time.Duration;

/**
 * Connection settings for the Concord agreement service.
 */
public class ConcordProperties {

	/**
	 * Concord API key, sent as {@code X-API-KEY}.
	 */
	private String apiKey = "";

	/**
	 * Concord REST API base URL.
	 */
	private String apiUrl = "https://api.concordnow.com/api/rest/1";

	/**
	 * Concord organization id owning the CLA template.
	 */
	private String organizationId = "";

	/**
	 * Id of the automated template the CLA is created from. Regular templates cannot be
	 * used through the API.
	 */
	private String templateId = "";

	/**
	 * Prefix of agreement titles; the contributor login is appended.
	 */
	private String agreementTitle = "Contributor License Agreement";

	/**
	 * Timeout for a single Concord request.
	 */
	private Duration requestTimeout = Duration.ofSeconds(30);

	/**
	 * Check the required settings are present.
	 * @throws IllegalStateException listing every missing setting
	 */
	public void validate() {
		StringBuilder missing = new StringBuilder();
		if (apiKey == null || apiKey.isBlank()) {
			missing.append(" CONCORD_API_KEY");
		}
		if (organizationId == null || organizationId.isBlank()) {
			missing.append(" CONCORD_ORGANIZATION_ID");
		}
		if (templateId == null || templateId.isBlank()) {
			missing.append(" CONCORD_TEMPLATE_ID");
		}
		if (missing.length() > 0) {
			throw new IllegalStateException("Missing required Concord settings:" + missing);
		}
	}

	public String getApiKey() {
		return apiKey;
	}

	public void setApiKey(String apiKey) {
		this.apiKey = apiKey;
	}

	public String getApiUrl() {
		return apiUrl;
	}

	public void setApiUrl(String apiUrl) {
		this.apiUrl = apiUrl;
	}

	public String getOrganizationId() {
		return organizationId;
	}

	public void setOrganizationId(String organizationId) {
		this.organizationId = organizationId;
	}

	public String getTemplateId() {
		return templateId;
	}

	public void setTemplateId(String templateId) {
		this.templateId = templateId;
	}

	public String getAgreementTitle() {
		return agreementTitle;
	}

	public void setAgreementTitle(String agreementTitle) {
		this.agreementTitle = agreementTitle;
	}

	public Duration getRequestTimeout() {
		return requestTimeout;
	}

	public void setRequestTimeout(Duration requestTimeout) {
		this.requestTimeout = requestTimeout;
	}

}
