package org.springaicommunity.clabot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * {@link AgreementClient} for the Concord contract management REST API.
 *
 * <p>
 * Agreements are created from an automated template, which creates the document, fills
 * its variables and invites the signer in one call. Requests authenticate with the
 * organization API key in the {@code X-API-KEY} header.
 */
public class ConcordAgreementClient implements AgreementClient {

	private static final Logger logger = LoggerFactory.getLogger(ConcordAgreementClient.class);

	private static final String SIGNER_PERMISSION = "NO_EDIT";

	private static final String SEARCH_STATUSES = "CURRENT_CONTRACT,UNKNOWN_CONTRACT";

	private final HttpClient httpClient;

	private final ConcordProperties properties;

	private final String apiUrl;

	private final String organizationName;

	private final ObjectMapper objectMapper;

	private final Clock clock;

	private final JsonNodeUtils json = new JsonNodeUtils();

	public ConcordAgreementClient(ConcordProperties properties, String organizationName, ObjectMapper objectMapper) {
		this(properties, organizationName, objectMapper, Clock.systemUTC());
	}

	public ConcordAgreementClient(ConcordProperties properties, String organizationName, ObjectMapper objectMapper,
			Clock clock) {
		this.properties = properties;
		this.apiUrl = properties.getApiUrl().endsWith("/")
				? properties.getApiUrl().substring(0, properties.getApiUrl().length() - 1) : properties.getApiUrl();
		this.organizationName = organizationName;
		this.objectMapper = objectMapper;
		this.clock = clock;
		this.httpClient = HttpClient.newBuilder().connectTimeout(properties.getRequestTimeout()).build();
	}

	@Override
	public String createAgreement(AgreementRequest request) {
		logger.info("Creating agreement for {} from template {} ({})", request.username(), properties.getTemplateId(),
				request.origin());

		ObjectNode body = objectMapper.createObjectNode();
		body.put("title", properties.getAgreementTitle() + " - " + request.username());
		body.put("description", "Contributor License Agreement for GitHub user @" + request.username());
		body.putArray("tags").add("CLA").add("GitHub");
		body.put("signatureRequired", 1);
		ObjectNode variables = body.putObject("variables");
		variables.put("contributor_name", request.name());
		variables.put("contributor_email", request.email());
		variables.put("github_username", request.username());
		variables.put("pull_request", request.origin());
		variables.put("date", LocalDate.now(clock).toString());
		body.putObject("inviteNowEmails").put(request.email(), SIGNER_PERMISSION);
		body.put("sendWithDocument", true);
		body.put("customMessageTitle", organizationName + " " + properties.getAgreementTitle());
		body.put("customMessageContent", invitationMessage(request.name()));

		JsonNode response = send("POST", organizationPath("/auto/" + properties.getTemplateId()), body.toString());
		String agreementRef = json.getString(response, "uid")
			.orElseThrow(() -> new AgreementServiceException("Agreement created without uid", 200, response.toString()));
		logger.info("Created agreement {} for {} (status {})", agreementRef, request.username(),
				json.getString(response, "status").orElse("unknown"));
		return agreementRef;
	}

	@Override
	public Optional<AgreementSummary> getAgreement(String agreementRef) {
		try {
			JsonNode response = send("GET", organizationPath("/agreements/" + agreementRef), null);
			return Optional.of(new AgreementSummary(json.getString(response, "uid").orElse(agreementRef),
					json.getString(response, "metadata", "title").orElse(""),
					json.getString(response, "metadata", "status").orElse(""),
					epochMillis(response, "summary", "lifecycle", "signatureDate")));
		}
		catch (AgreementServiceException e) {
			if (e.isNotFound()) {
				logger.info("Agreement {} not found", agreementRef);
				return Optional.empty();
			}
			throw e;
		}
	}

	@Override
	public Optional<AgreementSummary> findCurrentAgreementByEmail(String email) {
		try {
			String path = "/user/me/organizations/" + properties.getOrganizationId() + "/agreements?statuses="
					+ SEARCH_STATUSES + "&search=" + URLEncoder.encode(email, StandardCharsets.UTF_8);
			JsonNode response = send("GET", path, null);
			for (JsonNode item : json.getArray(response, "items")) {
				AgreementSummary summary = new AgreementSummary(json.getString(item, "uuid").orElse(""),
						json.getString(item, "title").orElse(""), json.getString(item, "status").orElse(""),
						epochMillis(item, "signatureDate"));
				if (summary.isCurrentContract() && !summary.agreementRef().isEmpty()) {
					return Optional.of(summary);
				}
			}
			return Optional.empty();
		}
		catch (AgreementServiceException e) {
			logger.warn("Could not search agreements for {}: {}", email, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void resendInvitation(String agreementRef, String email, String name, String username) {
		logger.info("Resending invitation for agreement {} to {} ({})", agreementRef, email, username);
		ObjectNode body = objectMapper.createObjectNode();
		body.putObject("invitations").putObject(email).put("permission", SIGNER_PERMISSION);
		ObjectNode message = body.putObject("message");
		message.put("subject", organizationName + " " + properties.getAgreementTitle());
		message.put("content", invitationMessage(name));
		body.put("sendWithDocument", true);
		send("POST", organizationPath("/agreements/" + agreementRef + "/members"), body.toString());
	}

	@Override
	public List<AgreementTemplate> listTemplates() {
		JsonNode response = send("GET", organizationPath("/auto"), null);
		List<AgreementTemplate> templates = new ArrayList<>();
		for (JsonNode node : json.getArray(response)) {
			json.getString(node, "uid")
				.ifPresent(uid -> templates.add(new AgreementTemplate(uid, json.getString(node, "title").orElse(""))));
		}
		return templates;
	}

	private String invitationMessage(String name) {
		return "Hello " + name + ",\n\n" + "Thank you for your contribution to " + organizationName
				+ "'s open source projects!\n\n"
				+ "Before we can merge your pull request, we need you to sign the Contributor License Agreement (CLA). "
				+ "This is a one-time process that covers all future contributions.\n\n"
				+ "Please review and sign the CLA using the link below.\n\n" + "Best regards,\n" + "The "
				+ organizationName + " Team";
	}

	private String organizationPath(String suffix) {
		return "/organizations/" + properties.getOrganizationId() + suffix;
	}

	private JsonNode send(String method, String path, @Nullable String body) {
		URI uri = URI.create(apiUrl + path);
		HttpRequest request = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(properties.getRequestTimeout())
			.header("X-API-KEY", properties.getApiKey())
			.header("Content-Type", "application/json")
			.header("Accept", "application/json")
			.method(method, body != null ? HttpRequest.BodyPublishers.ofString(body)
					: HttpRequest.BodyPublishers.noBody())
			.build();
		logger.debug("{} {}", method, uri);
		long start = System.currentTimeMillis();

		HttpResponse<String> response;
		try {
			response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
		}
		catch (IOException e) {
			logger.error("Concord request {} {} failed: {}", method, uri, e.getMessage());
			throw new AgreementServiceException("Concord request failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new AgreementServiceException("Concord request interrupted", e);
		}

		int status = response.statusCode();
		String responseBody = response.body() != null ? response.body() : "";
		logger.debug("{} {} returned {} in {}ms", method, uri, status, System.currentTimeMillis() - start);
		if (status < 200 || status >= 300) {
			if (status != 404) {
				logger.error("Concord API error {} for {} {}: {}", status, method, path, responseBody);
			}
			throw new AgreementServiceException("Concord API error: " + status, status, responseBody);
		}
		if (status == 204 || responseBody.isBlank()) {
			return objectMapper.createObjectNode();
		}
		try {
			return objectMapper.readTree(responseBody);
		}
		catch (JsonProcessingException e) {
			throw new AgreementServiceException("Malformed Concord response: " + e.getOriginalMessage(), e);
		}
	}

	private @Nullable Instant epochMillis(JsonNode node, String... path) {
		return json.getLong(node, path).map(Instant::ofEpochMilli).orElse(null);
	}

}
