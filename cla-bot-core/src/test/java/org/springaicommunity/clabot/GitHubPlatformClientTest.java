package org.springaicommunity.clabot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link GitHubPlatformClient} with a mocked {@link GitHubClient}.
 */
@DisplayName("GitHubPlatformClient Tests")
@ExtendWith(MockitoExtension.class)
class GitHubPlatformClientTest {

	private static final RepositoryRef WIDGETS = new RepositoryRef("acme", "widgets");

	private final ObjectMapper objectMapper = ObjectMapperFactory.create();

	@Mock
	private GitHubClient http;

	private GitHubPlatformClient platform;

	@BeforeEach
	void setUp() {
		platform = new GitHubPlatformClient(new InstallationClientCache(installationId -> http), () -> List.of(1L, 2L),
				objectMapper);
	}

	private static GitHubHttpClient.GitHubApiException status(int code) {
		return new GitHubHttpClient.GitHubApiException("GitHub API error: " + code, code, "{}");
	}

	private JsonNode sent(String body) throws Exception {
		return objectMapper.readTree(body);
	}

	@Nested
	@DisplayName("Pull requests and commits")
	class PullRequests {

		@Test
		@DisplayName("Should map pull request fields")
		void shouldGetPullRequest() {
			when(http.get("/repos/acme/widgets/pulls/7")).thenReturn("""
					{"number": 7, "state": "open", "head": {"sha": "abc"},
					 "user": {"login": "alice", "id": 1001}, "html_url": "https://github.com/acme/widgets/pull/7"}
					""");

			PullRequestDetails details = platform.getPullRequest(1, WIDGETS, 7);

			assertThat(details.headSha()).isEqualTo("abc");
			assertThat(details.authorId()).isEqualTo(1001L);
			assertThat(details.isOpen()).isTrue();
		}

		@Test
		@DisplayName("Should return distinct commit emails across pages in commit order")
		void shouldListCommitEmailsAcrossPages() {
			String fullPage = IntStream.range(0, 100)
				.mapToObj(i -> "{\"commit\":{\"author\":{\"email\":\"dev" + (i % 2) + "@example.com\"}}}")
				.collect(Collectors.joining(",", "[", "]"));
			when(http.getWithQuery("/repos/acme/widgets/pulls/7/commits", "per_page=100&page=1")).thenReturn(fullPage);
			when(http.getWithQuery("/repos/acme/widgets/pulls/7/commits", "per_page=100&page=2"))
				.thenReturn("[{\"commit\":{\"author\":{\"email\":\"late@example.com\"}}}]");

			assertThat(platform.listCommitAuthorEmails(1, WIDGETS, 7)).containsExactly("dev0@example.com",
					"dev1@example.com", "late@example.com");
		}

		@Test
		@DisplayName("Should degrade to no emails when commits cannot be read")
		void shouldDegradeCommitEmails() {
			when(http.getWithQuery(eq("/repos/acme/widgets/pulls/7/commits"), anyString())).thenThrow(status(500));

			assertThat(platform.listCommitAuthorEmails(1, WIDGETS, 7)).isEmpty();
		}

		@Test
		@DisplayName("Should treat a null profile email as absent")
		void shouldReadPublicEmail() {
			when(http.get("/users/alice")).thenReturn("{\"login\":\"alice\",\"email\":null}");

			assertThat(platform.getPublicEmail(1, "alice")).isEmpty();
		}

	}

	@Nested
	@DisplayName("Labels")
	class Labels {

		private final LabelDefinition pending = new LabelDefinition("cla:pending", "fbca04", "CLA signature required");

		@Test
		@DisplayName("Should create a missing label")
		void shouldCreateMissingLabel() throws Exception {
			when(http.get("/repos/acme/widgets/labels/cla%3Apending")).thenThrow(status(404));
			when(http.post(eq("/repos/acme/widgets/labels"), anyString())).thenReturn("{}");

			platform.ensureLabel(1, WIDGETS, pending);

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(http).post(eq("/repos/acme/widgets/labels"), body.capture());
			assertThat(sent(body.getValue()).path("color").asText()).isEqualTo("fbca04");
		}

		@Test
		@DisplayName("Should not create a label that exists")
		void shouldKeepExistingLabel() {
			when(http.get("/repos/acme/widgets/labels/cla%3Apending")).thenReturn("{\"name\":\"cla:pending\"}");

			platform.ensureLabel(1, WIDGETS, pending);

			verify(http, never()).post(anyString(), anyString());
		}

		@Test
		@DisplayName("Should accept a label created concurrently")
		void shouldTolerateConcurrentCreation() {
			when(http.get("/repos/acme/widgets/labels/cla%3Apending")).thenThrow(status(404));
			when(http.post(eq("/repos/acme/widgets/labels"), anyString())).thenThrow(status(422));

			platform.ensureLabel(1, WIDGETS, pending);
		}

		@Test
		@DisplayName("Should report a label that was not applied")
		void shouldReportMissingLabelOnRemove() {
			when(http.delete("/repos/acme/widgets/issues/7/labels/cla%3Apending")).thenThrow(status(404));

			assertThat(platform.removeLabel(1, WIDGETS, 7, "cla:pending")).isFalse();
		}

	}

	@Nested
	@DisplayName("Statuses and comments")
	class StatusesAndComments {

		@Test
		@DisplayName("Should post a commit status with a truncated description")
		void shouldCreateCommitStatus() throws Exception {
			when(http.post(eq("/repos/acme/widgets/statuses/abc"), anyString())).thenReturn("{}");

			platform.createCommitStatus(1, WIDGETS, "abc",
					new CommitStatus(CommitState.PENDING, "cla/signature", "x".repeat(200), null));

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(http).post(eq("/repos/acme/widgets/statuses/abc"), body.capture());
			JsonNode status = sent(body.getValue());
			assertThat(status.path("state").asText()).isEqualTo("pending");
			assertThat(status.path("description").asText()).hasSize(140).endsWith("...");
			assertThat(status.has("target_url")).isFalse();
		}

		@Test
		@DisplayName("Should return the id of a new comment")
		void shouldCreateComment() {
			when(http.post(eq("/repos/acme/widgets/issues/7/comments"), anyString())).thenReturn("{\"id\":987}");

			assertThat(platform.createComment(1, WIDGETS, 7, "hello")).isEqualTo(987L);
		}

		@Test
		@DisplayName("Should propagate status failures")
		void shouldPropagateStatusFailure() {
			when(http.post(eq("/repos/acme/widgets/statuses/abc"), anyString())).thenThrow(status(403));

			assertThatThrownBy(() -> platform.createCommitStatus(1, WIDGETS, "abc",
					new CommitStatus(CommitState.SUCCESS, "cla/signature", "ok", null)))
				.isInstanceOf(GitHubHttpClient.GitHubApiException.class);
		}

	}

	@Nested
	@DisplayName("Organizations and installations")
	class Installations {

		@Test
		@DisplayName("Should report membership from the response status")
		void shouldCheckMembership() {
			when(http.get("/orgs/acme/members/alice")).thenReturn("");
			when(http.get("/orgs/acme/members/mallory")).thenThrow(status(404));
			when(http.get("/orgs/acme/members/bob")).thenThrow(status(500));

			assertThat(platform.isOrganizationMember(1, "acme", "alice")).isTrue();
			assertThat(platform.isOrganizationMember(1, "acme", "mallory")).isFalse();
			assertThat(platform.isOrganizationMember(1, "acme", "bob")).isFalse();
		}

		@Test
		@DisplayName("Should list installation repositories")
		void shouldListRepositories() {
			when(http.getWithQuery("/installation/repositories", "per_page=100&page=1"))
				.thenReturn("{\"total_count\":2,\"repositories\":[{\"full_name\":\"acme/widgets\"},"
						+ "{\"full_name\":\"acme/gadgets\"}]}");

			assertThat(platform.listInstallationRepositories(1)).containsExactly(WIDGETS,
					new RepositoryRef("acme", "gadgets"));
			assertThat(platform.listInstallationIds()).containsExactly(1L, 2L);
		}

	}

}
