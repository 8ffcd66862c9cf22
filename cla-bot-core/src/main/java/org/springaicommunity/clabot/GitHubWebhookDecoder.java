package org.springaicommunity.clabot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.util.Optional;

/**
 * Decodes GitHub webhook bodies into events. Only the fields the bot needs are read;
 * missing required fields raise {@link InvalidWebhookPayloadException}. A payload without
 * an installation cannot be acted on and decodes to an empty result.
 */
public class GitHubWebhookDecoder {

	private final ObjectMapper objectMapper;

	private final JsonNodeUtils json = new JsonNodeUtils();

	public GitHubWebhookDecoder(ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
	}

	public Optional<PullRequestEvent> decodePullRequest(byte[] body) {
		JsonNode root = parse(body);
		Optional<Long> installationId = installationId(root);
		if (installationId.isEmpty()) {
			return Optional.empty();
		}
		JsonNode pullRequest = root.path("pull_request");
		return Optional.of(new PullRequestEvent(PullRequestAction.fromWireName(require(root, "action")),
				repository(root),
				json.getInt(pullRequest, "number")
					.or(() -> json.getInt(root, "number"))
					.orElseThrow(() -> missing("pull_request.number")),
				contributor(pullRequest.path("user"), "pull_request.user"), require(pullRequest, "head", "sha"),
				installationId.get()));
	}

	public Optional<IssueCommentEvent> decodeIssueComment(byte[] body) {
		JsonNode root = parse(body);
		Optional<Long> installationId = installationId(root);
		if (installationId.isEmpty()) {
			return Optional.empty();
		}
		JsonNode issue = root.path("issue");
		return Optional.of(new IssueCommentEvent(require(root, "action"), repository(root),
				json.getInt(issue, "number").orElseThrow(() -> missing("issue.number")),
				json.has(issue, "pull_request"), contributor(issue.path("user"), "issue.user"),
				require(root, "comment", "user", "login"), json.getString(root, "comment", "body").orElse(""),
				installationId.get()));
	}

	private JsonNode parse(byte[] body) {
		try {
			JsonNode root = objectMapper.readTree(body);
			if (root == null || !root.isObject()) {
				throw new InvalidWebhookPayloadException("Webhook body is not a JSON object");
			}
			return root;
		}
		catch (IOException e) {
			throw new InvalidWebhookPayloadException("Webhook body is not valid JSON", e);
		}
	}

	private RepositoryRef repository(JsonNode root) {
		String fullName = require(root, "repository", "full_name");
		try {
			return RepositoryRef.parse(fullName);
		}
		catch (IllegalArgumentException e) {
			throw new InvalidWebhookPayloadException(e.getMessage(), e);
		}
	}

	private Contributor contributor(JsonNode user, String location) {
		long id = json.getLong(user, "id").orElseThrow(() -> missing(location + ".id"));
		String login = json.getString(user, "login").orElseThrow(() -> missing(location + ".login"));
		return new Contributor(id, login, json.getString(user, "name").orElse(null));
	}

	private Optional<Long> installationId(JsonNode root) {
		return json.getLong(root, "installation", "id");
	}

	private String require(JsonNode node, String... path) {
		return json.getString(node, path).orElseThrow(() -> missing(String.join(".", path)));
	}

	private static InvalidWebhookPayloadException missing(String field) {
		return new InvalidWebhookPayloadException("Webhook payload has no " + field);
	}

}
