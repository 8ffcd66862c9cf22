package org.springaicommunity.clabot;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Scenario tests for {@link CompletionReconciler} against a real record store.
 */
@DisplayName("CompletionReconciler Tests")
@ExtendWith(MockitoExtension.class)
class CompletionReconcilerTest {

	private static final Instant NOW = Instant.parse("2024-05-02T09:00:00Z");

	private static final long INSTALLATION = 42L;

	private static final RepositoryRef WIDGETS = new RepositoryRef("acme", "widgets");

	private static final RepositoryRef GADGETS = new RepositoryRef("acme", "gadgets");

	private final Contributor alice = new Contributor(1001, "alice", "Alice");

	@Mock
	private PlatformClient platform;

	private TestDatabase database;

	private AgreementRecordRepository records;

	private CompletionReconciler reconciler;

	@BeforeEach
	void setUp() {
		database = new TestDatabase();
		records = database.repository(Clock.fixed(NOW, ZoneOffset.UTC));
		ClaProperties properties = new ClaProperties();
		properties.setOrganizationName("Acme");
		reconciler = new CompletionReconciler(records, platform, properties, Clock.fixed(NOW, ZoneOffset.UTC));
	}

	@AfterEach
	void tearDown() {
		database.close();
	}

	private static AgreementEvent event(AgreementEventKind kind, String agreementRef) {
		return new AgreementEvent(kind, kind.wireName(), "ev-1", agreementRef, null, null);
	}

	private static PullRequestDetails details(int number, String sha) {
		return new PullRequestDetails(number, "open", sha, "alice", 1001,
				"https://github.com/acme/repo/pull/" + number);
	}

	private void trackTwoPullRequests() {
		records.upsertAgreement(ContributorAgreement.pending(alice, "alice@example.com", "AG-1"));
		records.upsertTrackedPullRequest(TrackedPullRequest.of(WIDGETS, 7, alice, 555L, "AG-1"));
		records.upsertTrackedPullRequest(TrackedPullRequest.of(GADGETS, 3, alice, null, "AG-1"));
	}

	private void stubInstallation(RepositoryRef... accessible) {
		when(platform.listInstallationIds()).thenReturn(List.of(INSTALLATION));
		when(platform.listInstallationRepositories(INSTALLATION)).thenReturn(List.of(accessible));
	}

	@Nested
	@DisplayName("Signature events")
	class SignatureEvents {

		@Test
		@DisplayName("Should mark signed and flip every tracked pull request to success")
		void shouldFanOutAcrossRepositories() {
			trackTwoPullRequests();
			stubInstallation(WIDGETS, GADGETS);
			when(platform.getPullRequest(INSTALLATION, WIDGETS, 7)).thenReturn(details(7, "sha-7"));
			when(platform.getPullRequest(INSTALLATION, GADGETS, 3)).thenReturn(details(3, "sha-3"));

			FanOutReport report = reconciler.handle(event(AgreementEventKind.EXECUTED, "AG-1"));

			assertThat(report.transitioned()).isTrue();
			assertThat(report.updated()).isEqualTo(2);
			assertThat(report.failed()).isEmpty();

			ContributorAgreement agreement = records.findAgreementByUserId(1001).orElseThrow();
			assertThat(agreement.isSigned()).isTrue();
			assertThat(agreement.signedAt()).isEqualTo(NOW);

			ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
			verify(platform).updateComment(eq(INSTALLATION), eq(WIDGETS), eq(555L), body.capture());
			assertThat(body.getValue()).contains("CLA has been signed").contains("@alice");

			ArgumentCaptor<CommitStatus> status = ArgumentCaptor.forClass(CommitStatus.class);
			verify(platform).createCommitStatus(eq(INSTALLATION), eq(WIDGETS), eq("sha-7"), status.capture());
			verify(platform).createCommitStatus(eq(INSTALLATION), eq(GADGETS), eq("sha-3"), status.capture());
			assertThat(status.getAllValues()).extracting(CommitStatus::state)
				.containsOnly(CommitState.SUCCESS);
			verify(platform).removeLabel(INSTALLATION, GADGETS, 3, "cla:pending");
			verify(platform).addLabel(INSTALLATION, WIDGETS, 7, "cla:signed");
		}

		@Test
		@DisplayName("Should still update the other pull requests when one fails")
		void shouldIsolateFailures() {
			trackTwoPullRequests();
			stubInstallation(WIDGETS, GADGETS);
			when(platform.getPullRequest(INSTALLATION, GADGETS, 3))
				.thenThrow(new GitHubHttpClient.GitHubApiException("GitHub API error: 502", 502, "Bad Gateway"));
			when(platform.getPullRequest(INSTALLATION, WIDGETS, 7)).thenReturn(details(7, "sha-7"));

			FanOutReport report = reconciler.handle(event(AgreementEventKind.EXECUTED, "AG-1"));

			assertThat(report.updated()).isEqualTo(1);
			assertThat(report.failed()).containsExactly("acme/gadgets#3");
			verify(platform).createCommitStatus(eq(INSTALLATION), eq(WIDGETS), eq("sha-7"), any());
			assertThat(records.findAgreementByUserId(1001).orElseThrow().isSigned()).isTrue();
		}

		@Test
		@DisplayName("Should not repeat the fan-out for a second signature event")
		void shouldIgnoreRepeatedSignature() {
			trackTwoPullRequests();
			stubInstallation(WIDGETS, GADGETS);
			when(platform.getPullRequest(INSTALLATION, WIDGETS, 7)).thenReturn(details(7, "sha-7"));
			when(platform.getPullRequest(INSTALLATION, GADGETS, 3)).thenReturn(details(3, "sha-3"));

			reconciler.handle(event(AgreementEventKind.NEW_SIGNATURE, "AG-1"));
			FanOutReport second = reconciler.handle(event(AgreementEventKind.EXECUTED, "AG-1"));

			assertThat(second.transitioned()).isFalse();
			assertThat(second.total()).isZero();
			verify(platform, times(1)).getPullRequest(INSTALLATION, WIDGETS, 7);
			verify(platform, times(1)).updateComment(anyLong(), any(), anyLong(), anyString());
		}

		@Test
		@DisplayName("Should skip pull requests no installation can reach")
		void shouldSkipUnreachableRepositories() {
			trackTwoPullRequests();
			stubInstallation(WIDGETS);
			when(platform.getPullRequest(INSTALLATION, WIDGETS, 7)).thenReturn(details(7, "sha-7"));

			FanOutReport report = reconciler.handle(event(AgreementEventKind.EXECUTED, "AG-1"));

			assertThat(report.updated()).isEqualTo(1);
			assertThat(report.skipped()).isEqualTo(1);
			verify(platform, never()).getPullRequest(anyLong(), eq(GADGETS), anyInt());
			verify(platform, times(1)).listInstallationRepositories(INSTALLATION);
		}

		@Test
		@DisplayName("Should find the record by the signed agreement reference")
		void shouldFallBackToSignedReference() {
			records.upsertAgreement(ContributorAgreement.pending(alice, "alice@example.com", "AG-1S"));

			FanOutReport report = reconciler.handle(new AgreementEvent(AgreementEventKind.EXECUTED,
					"AGREEMENT_EXECUTED", "ev-2", "AG-NEGOTIATED", "AG-1S", "alice@example.com"));

			assertThat(report.transitioned()).isTrue();
			assertThat(report.total()).isZero();
			assertThat(records.findAgreementByReference("AG-1S").orElseThrow().isSigned()).isTrue();
		}

		@Test
		@DisplayName("Should ignore agreements the bot never created")
		void shouldIgnoreUnknownAgreement() {
			FanOutReport report = reconciler.handle(event(AgreementEventKind.EXECUTED, "AG-UNKNOWN"));

			assertThat(report.transitioned()).isFalse();
			verifyNoInteractions(platform);
		}

	}

	@Test
	@DisplayName("Should record cancellation without touching pull requests")
	void shouldRecordCancellation() {
		trackTwoPullRequests();

		FanOutReport report = reconciler.handle(event(AgreementEventKind.CANCELLED, "AG-1"));

		assertThat(report.transitioned()).isFalse();
		assertThat(records.findAgreementByUserId(1001).orElseThrow().status()).isEqualTo(ClaStatus.CANCELLED);
		verifyNoInteractions(platform);
	}

	@Test
	@DisplayName("Should ignore unsupported events")
	void shouldIgnoreUnsupportedEvents() {
		trackTwoPullRequests();

		reconciler.handle(new AgreementEvent(AgreementEventKind.UNSUPPORTED, "MEMBER_INVITED", null, "AG-1", null,
				null));

		assertThat(records.findAgreementByUserId(1001).orElseThrow().isPending()).isTrue();
		verifyNoInteractions(platform);
	}

}
