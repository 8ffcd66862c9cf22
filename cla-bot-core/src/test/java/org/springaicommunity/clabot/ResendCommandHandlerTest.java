package org.springaicommunity.clabot;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Tests for the {@code /cla resend} command.
 */
@DisplayName("ResendCommandHandler Tests")
@ExtendWith(MockitoExtension.class)
class ResendCommandHandlerTest {

	private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

	private static final long INSTALLATION = 42L;

	private static final RepositoryRef WIDGETS = new RepositoryRef("acme", "widgets");

	private final Contributor alice = new Contributor(1001, "alice", "Alice");

	@Mock
	private PlatformClient platform;

	@Mock
	private AgreementClient agreements;

	private TestDatabase database;

	private AgreementRecordRepository records;

	private ResendCommandHandler handler;

	@BeforeEach
	void setUp() {
		database = new TestDatabase();
		records = database.repository(Clock.fixed(NOW, ZoneOffset.UTC));
		handler = new ResendCommandHandler(records, platform, agreements, new ClaProperties());
	}

	@AfterEach
	void tearDown() {
		database.close();
	}

	private IssueCommentEvent comment(String body) {
		return new IssueCommentEvent("created", WIDGETS, 7, true, alice, "maintainer", body, INSTALLATION);
	}

	private static PullRequestDetails pullRequest() {
		return new PullRequestDetails(7, "open", "sha-7", "alice", 1001, "https://github.com/acme/widgets/pull/7");
	}

	private String reply() {
		ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
		verify(platform).createComment(eq(INSTALLATION), eq(WIDGETS), eq(7), body.capture());
		return body.getValue();
	}

	@Test
	@DisplayName("Should recognise the command regardless of case and surrounding whitespace")
	void shouldRecogniseCommand() {
		assertThat(ResendCommandHandler.isResendCommand("  /CLA Resend\n")).isTrue();
		assertThat(ResendCommandHandler.isResendCommand("please /cla resend")).isFalse();
		assertThat(ResendCommandHandler.isResendCommand("/cla resend now")).isFalse();
	}

	@Test
	@DisplayName("Should ignore other comments and comments on issues")
	void shouldIgnoreOtherComments() {
		assertThat(handler.handle(comment("LGTM"))).isEqualTo(ResendOutcome.IGNORED);
		assertThat(handler.handle(new IssueCommentEvent("created", WIDGETS, 8, false, alice, "alice", "/cla resend",
				INSTALLATION)))
			.isEqualTo(ResendOutcome.IGNORED);
		assertThat(handler.handle(new IssueCommentEvent("edited", WIDGETS, 7, true, alice, "alice", "/cla resend",
				INSTALLATION)))
			.isEqualTo(ResendOutcome.IGNORED);
		verifyNoInteractions(platform, agreements);
	}

	@Test
	@DisplayName("Should only reply when the agreement is already signed")
	void shouldReplyWhenSigned() {
		records.upsertAgreement(ContributorAgreement.signed(alice, "alice@example.com", "AG-1", NOW));

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.ALREADY_SIGNED);

		verifyNoInteractions(agreements);
		assertThat(reply()).startsWith("@maintainer").contains("already been signed");
	}

	@Test
	@DisplayName("Should resend the invitation of a pending agreement")
	void shouldResendPendingInvitation() {
		records.upsertAgreement(ContributorAgreement.pending(alice, "alice@example.com", "AG-1"));
		when(agreements.getAgreement("AG-1"))
			.thenReturn(Optional.of(new AgreementSummary("AG-1", "CLA - alice", "SIGNING", null)));

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.INVITATION_RESENT);

		verify(agreements).resendInvitation("AG-1", "alice@example.com", "Alice", "alice");
		verify(agreements, never()).createAgreement(any());
		assertThat(reply()).contains("a***@example.com").doesNotContain("alice@example.com");
	}

	@Test
	@DisplayName("Should replace an agreement deleted in the agreement service")
	void shouldReplaceDeletedAgreement() {
		records.upsertAgreement(ContributorAgreement.pending(alice, "alice@example.com", "AG-1"));
		records.upsertTrackedPullRequest(TrackedPullRequest.of(WIDGETS, 7, alice, 555L, "AG-1"));
		when(agreements.getAgreement("AG-1")).thenReturn(Optional.empty());
		when(platform.listCommitAuthorEmails(INSTALLATION, WIDGETS, 7)).thenReturn(List.of("alice@example.com"));
		when(agreements.createAgreement(any())).thenReturn("AG-2");
		when(platform.getPullRequest(INSTALLATION, WIDGETS, 7)).thenReturn(pullRequest());

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.NEW_AGREEMENT_SENT);

		ContributorAgreement agreement = records.findAgreementByUserId(1001).orElseThrow();
		assertThat(agreement.agreementRef()).isEqualTo("AG-2");
		assertThat(agreement.isPending()).isTrue();
		TrackedPullRequest tracked = records.findTrackedPullRequest("acme/widgets", 7, 1001).orElseThrow();
		assertThat(tracked.agreementRef()).isEqualTo("AG-2");
		assertThat(tracked.commentId()).isEqualTo(555L);
		verify(platform).createCommitStatus(eq(INSTALLATION), eq(WIDGETS), eq("sha-7"), any());
		assertThat(reply()).contains("new CLA signing invitation");
	}

	@Test
	@DisplayName("Should create a new agreement after cancellation")
	void shouldCreateAfterCancellation() {
		records.upsertAgreement(new ContributorAgreement("alice", 1001, "alice@example.com", "AG-1",
				ClaStatus.CANCELLED, null, null, null));
		when(agreements.createAgreement(any())).thenReturn("AG-2");
		when(platform.getPullRequest(INSTALLATION, WIDGETS, 7)).thenReturn(pullRequest());

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.NEW_AGREEMENT_SENT);

		verify(agreements, never()).getAgreement(anyString());
		assertThat(records.findAgreementByUserId(1001).orElseThrow().agreementRef()).isEqualTo("AG-2");
	}

	@Test
	@DisplayName("Should only reply for an allow-listed author, leaving the exempt status alone")
	void shouldNotSendAgreementToAllowListedAuthor() {
		ClaProperties properties = new ClaProperties();
		properties.setExemptedUsers(List.of("Dependabot[bot]"));
		ResendCommandHandler exemptAware = new ResendCommandHandler(records, platform, agreements, properties);
		Contributor bot = new Contributor(49699333, "dependabot[bot]", null);

		ResendOutcome outcome = exemptAware.handle(
				new IssueCommentEvent("created", WIDGETS, 7, true, bot, "drive-by", "/cla resend", INSTALLATION));

		assertThat(outcome).isEqualTo(ResendOutcome.EXEMPT);
		verifyNoInteractions(agreements);
		verify(platform, never()).isOrganizationMember(anyLong(), anyString(), anyString());
		verify(platform, never()).createCommitStatus(anyLong(), any(), anyString(), any());
		assertThat(records.findAgreementByUserId(bot.id())).isEmpty();
		assertThat(records.findTrackedPullRequest("acme/widgets", 7, bot.id())).isEmpty();
		assertThat(reply()).startsWith("@drive-by").contains("@dependabot[bot] does not need to sign");
	}

	@Test
	@DisplayName("Should only reply for an organization member")
	void shouldNotSendAgreementToOrganizationMember() {
		when(platform.isOrganizationMember(INSTALLATION, "acme", "alice")).thenReturn(true);

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.EXEMPT);

		verifyNoInteractions(agreements);
		verify(platform, never()).createCommitStatus(anyLong(), any(), anyString(), any());
		assertThat(records.findAgreementByUserId(1001)).isEmpty();
		assertThat(reply()).contains("does not need to sign");
	}

	@Test
	@DisplayName("Should point an existing tracked pull request at the new agreement")
	void shouldUpdateTrackedReference() {
		records.upsertTrackedPullRequest(TrackedPullRequest.of(WIDGETS, 7, alice, 555L, "AG-1"));
		when(agreements.createAgreement(any())).thenReturn("AG-2");
		when(platform.getPullRequest(INSTALLATION, WIDGETS, 7)).thenReturn(pullRequest());

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.NEW_AGREEMENT_SENT);

		assertThat(records.findTrackedPullRequestsByUserId(1001)).singleElement().satisfies(tracked -> {
			assertThat(tracked.agreementRef()).isEqualTo("AG-2");
			assertThat(tracked.commentId()).isEqualTo(555L);
		});
	}

	@Test
	@DisplayName("Should still confirm the invitation when the pull request cannot be read")
	void shouldConfirmWhenPullRequestLookupFails() {
		when(agreements.createAgreement(any())).thenReturn("AG-2");
		when(platform.getPullRequest(INSTALLATION, WIDGETS, 7))
			.thenThrow(new GitHubHttpClient.GitHubApiException("Bad gateway", 502, ""));

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.NEW_AGREEMENT_SENT);

		assertThat(records.findAgreementByUserId(1001)).get()
			.extracting(ContributorAgreement::agreementRef)
			.isEqualTo("AG-2");
		verify(platform, never()).createCommitStatus(anyLong(), any(), anyString(), any());
		assertThat(reply()).startsWith("@maintainer").contains("new CLA signing invitation");
	}

	@Test
	@DisplayName("Should tell the commenter when no invitation could be sent")
	void shouldReplyOnFailure() {
		when(agreements.createAgreement(any()))
			.thenThrow(new AgreementServiceException("Concord unavailable", 503, null));

		assertThat(handler.handle(comment("/cla resend"))).isEqualTo(ResendOutcome.FAILED);

		assertThat(records.findAgreementByUserId(1001)).isEmpty();
		assertThat(reply()).startsWith("@maintainer").contains("could not be sent");
	}

}
