package org.springaicommunity.clabot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * {@link PlatformClient} over the GitHub REST API.
 *
 * <p>
 * Converts GitHub API JSON responses to records at the client boundary. Each call runs
 * through the {@link GitHubClient} of the installation, taken from the
 * {@link InstallationClientCache}.
 */
public class GitHubPlatformClient implements PlatformClient {

	private static final Logger logger = LoggerFactory.getLogger(GitHubPlatformClient.class);

	private static final int PAGE_SIZE = 100;

	private final InstallationClientCache clients;

	private final Supplier<List<Long>> installationLister;

	private final ObjectMapper objectMapper;

	private final JsonNodeUtils json = new JsonNodeUtils();

	public GitHubPlatformClient(InstallationClientCache clients, Supplier<List<Long>> installationLister,
			ObjectMapper objectMapper) {
		this.clients = clients;
		this.installationLister = installationLister;
		this.objectMapper = objectMapper;
	}

	@Override
	public PullRequestDetails getPullRequest(long installationId, RepositoryRef repository, int number) {
		JsonNode node = readTree(client(installationId).get(repoPath(repository) + "/pulls/" + number));
		return new PullRequestDetails(node.path("number").asInt(number), node.path("state").asText(""),
				node.path("head").path("sha").asText(""), node.path("user").path("login").asText(""),
				node.path("user").path("id").asLong(), node.path("html_url").asText(""));
	}

	@Override
	public List<String> listCommitAuthorEmails(long installationId, RepositoryRef repository, int number) {
		try {
			Set<String> emails = new LinkedHashSet<>();
			for (JsonNode commit : getAllPages(client(installationId), repoPath(repository) + "/pulls/" + number
					+ "/commits", null)) {
				json.getString(commit, "commit", "author", "email")
					.filter(email -> !email.isBlank())
					.ifPresent(emails::add);
			}
			return new ArrayList<>(emails);
		}
		catch (RuntimeException e) {
			logger.warn("Could not read commit emails of {}#{}: {}", repository, number, e.getMessage());
			return List.of();
		}
	}

	@Override
	public Optional<String> getPublicEmail(long installationId, String username) {
		try {
			JsonNode user = readTree(client(installationId).get("/users/" + encode(username)));
			return json.getString(user, "email").filter(email -> !email.isBlank());
		}
		catch (RuntimeException e) {
			logger.warn("Could not fetch profile of {}: {}", username, e.getMessage());
			return Optional.empty();
		}
	}

	@Override
	public void ensureLabel(long installationId, RepositoryRef repository, LabelDefinition label) {
		GitHubClient client = client(installationId);
		try {
			client.get(repoPath(repository) + "/labels/" + encode(label.name()));
			return;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (!e.isNotFound()) {
				throw e;
			}
		}
		ObjectNode body = objectMapper.createObjectNode()
			.put("name", label.name())
			.put("color", label.color())
			.put("description", label.description());
		try {
			client.post(repoPath(repository) + "/labels", body.toString());
			logger.info("Created label '{}' in {}", label.name(), repository);
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			// 422: created concurrently by another webhook
			if (e.getStatusCode() != 422) {
				throw e;
			}
			logger.debug("Label '{}' already exists in {}", label.name(), repository);
		}
	}

	@Override
	public void addLabel(long installationId, RepositoryRef repository, int number, String label) {
		ObjectNode body = objectMapper.createObjectNode();
		body.putArray("labels").add(label);
		client(installationId).post(repoPath(repository) + "/issues/" + number + "/labels", body.toString());
		logger.debug("Added label '{}' to {}#{}", label, repository, number);
	}

	@Override
	public boolean removeLabel(long installationId, RepositoryRef repository, int number, String label) {
		try {
			client(installationId).delete(repoPath(repository) + "/issues/" + number + "/labels/" + encode(label));
			logger.debug("Removed label '{}' from {}#{}", label, repository, number);
			return true;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (e.isNotFound()) {
				return false;
			}
			throw e;
		}
	}

	@Override
	public void createCommitStatus(long installationId, RepositoryRef repository, String sha, CommitStatus status) {
		ObjectNode body = objectMapper.createObjectNode()
			.put("state", status.state().value())
			.put("context", status.context())
			.put("description", truncate(status.description(), 140));
		if (status.targetUrl() != null && !status.targetUrl().isBlank()) {
			body.put("target_url", status.targetUrl());
		}
		client(installationId).post(repoPath(repository) + "/statuses/" + sha, body.toString());
		logger.info("Set {} status '{}' on {}@{}", status.state().value(), status.context(), repository, sha);
	}

	@Override
	public long createComment(long installationId, RepositoryRef repository, int number, String body) {
		ObjectNode request = objectMapper.createObjectNode().put("body", body);
		JsonNode comment = readTree(
				client(installationId).post(repoPath(repository) + "/issues/" + number + "/comments", request.toString()));
		long commentId = comment.path("id").asLong();
		logger.info("Posted comment {} on {}#{}", commentId, repository, number);
		return commentId;
	}

	@Override
	public void updateComment(long installationId, RepositoryRef repository, long commentId, String body) {
		ObjectNode request = objectMapper.createObjectNode().put("body", body);
		client(installationId).patch(repoPath(repository) + "/issues/comments/" + commentId, request.toString());
		logger.info("Updated comment {} in {}", commentId, repository);
	}

	@Override
	public boolean isOrganizationMember(long installationId, String organization, String username) {
		try {
			// 204 for members, 404 for non-members
			client(installationId).get("/orgs/" + encode(organization) + "/members/" + encode(username));
			return true;
		}
		catch (GitHubHttpClient.GitHubApiException e) {
			if (!e.isNotFound()) {
				logger.warn("Could not check membership of {} in {}: {}", username, organization, e.getMessage());
			}
			return false;
		}
	}

	@Override
	public List<Long> listInstallationIds() {
		return installationLister.get();
	}

	@Override
	public List<RepositoryRef> listInstallationRepositories(long installationId) {
		List<RepositoryRef> repositories = new ArrayList<>();
		for (JsonNode repo : getAllPages(client(installationId), "/installation/repositories", "repositories")) {
			json.getString(repo, "full_name").map(RepositoryRef::parse).ifPresent(repositories::add);
		}
		return repositories;
	}

	/**
	 * Follow numbered pages until a short page is returned.
	 * @param arrayField field holding the items, or null when the response is the array
	 */
	private List<JsonNode> getAllPages(GitHubClient client, String path, @Nullable String arrayField) {
		List<JsonNode> items = new ArrayList<>();
		int page = 1;
		while (true) {
			JsonNode response = readTree(client.getWithQuery(path, "per_page=" + PAGE_SIZE + "&page=" + page));
			List<JsonNode> pageItems = arrayField != null ? json.getArray(response, arrayField)
					: json.getArray(response);
			items.addAll(pageItems);
			if (pageItems.size() < PAGE_SIZE) {
				return items;
			}
			page++;
		}
	}

	private GitHubClient client(long installationId) {
		return clients.forInstallation(installationId);
	}

	private JsonNode readTree(String body) {
		try {
			return objectMapper.readTree(body.isEmpty() ? "{}" : body);
		}
		catch (JsonProcessingException e) {
			throw new GitHubHttpClient.GitHubApiException("Malformed GitHub response: " + e.getOriginalMessage(), e);
		}
	}

	private static String repoPath(RepositoryRef repository) {
		return "/repos/" + repository.owner() + "/" + repository.name();
	}

	private static String encode(String value) {
		return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
	}

	private static String truncate(String value, int maxLength) {
		return value.length() <= maxLength ? value : value.substring(0, maxLength - 3) + "...";
	}

}
