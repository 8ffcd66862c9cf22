package org.springaicommunity.clabot.app;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springaicommunity.clabot.GitHubEventType;
import org.springaicommunity.clabot.GitHubWebhookDecoder;
import org.springaicommunity.clabot.IssueCommentEvent;
import org.springaicommunity.clabot.PullRequestEvent;
import org.springaicommunity.clabot.ReconciliationOutcome;
import org.springaicommunity.clabot.ResendCommandHandler;
import org.springaicommunity.clabot.ResendOutcome;
import org.springaicommunity.clabot.SignatureReconciler;
import org.springaicommunity.clabot.WebhookSignatureVerifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.Optional;

/**
 * Receives GitHub App webhooks.
 *
 * <p>
 * The signature is checked against the raw body before anything is decoded. Every
 * verified delivery is answered with 200 once handled, or 500 if handling failed, so
 * GitHub shows the failure in the app's delivery log.
 */
@RestController
@RequestMapping("/github")
public class GitHubWebhookController {

	private static final Logger logger = LoggerFactory.getLogger(GitHubWebhookController.class);

	static final String DELIVERY_MDC_KEY = "delivery";

	private final WebhookSignatureVerifier signatureVerifier;

	private final GitHubWebhookDecoder decoder;

	private final SignatureReconciler signatureReconciler;

	private final ResendCommandHandler resendCommandHandler;

	public GitHubWebhookController(WebhookSignatureVerifier signatureVerifier, GitHubWebhookDecoder decoder,
			SignatureReconciler signatureReconciler, ResendCommandHandler resendCommandHandler) {
		this.signatureVerifier = signatureVerifier;
		this.decoder = decoder;
		this.signatureReconciler = signatureReconciler;
		this.resendCommandHandler = resendCommandHandler;
	}

	@PostMapping("/webhook")
	public ResponseEntity<Map<String, Object>> webhook(
			@RequestHeader(value = "X-Hub-Signature-256", required = false) @Nullable String signature,
			@RequestHeader(value = "X-GitHub-Event", required = false) @Nullable String event,
			@RequestHeader(value = "X-GitHub-Delivery", required = false) @Nullable String deliveryId,
			@RequestBody(required = false) byte @Nullable [] body) {
		byte[] payload = body != null ? body : new byte[0];
		MDC.put(DELIVERY_MDC_KEY, deliveryId != null ? deliveryId : "-");
		try {
			if (!signatureVerifier.verify(payload, signature)) {
				logger.warn("Rejected {} webhook with invalid signature", event);
				return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of("error", "Invalid signature"));
			}
			logger.debug("Received {} webhook ({} bytes)", event, payload.length);
			dispatch(GitHubEventType.fromHeader(event), event, payload);
			return ResponseEntity.ok(Map.of("success", true));
		}
		catch (RuntimeException e) {
			logger.error("Failed to handle {} webhook: {}", event, e.getMessage(), e);
			return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
				.body(Map.of("error", "Internal server error"));
		}
		finally {
			MDC.remove(DELIVERY_MDC_KEY);
		}
	}

	private void dispatch(GitHubEventType type, @Nullable String event, byte[] payload) {
		switch (type) {
			case PULL_REQUEST -> {
				Optional<PullRequestEvent> decoded = decoder.decodePullRequest(payload);
				if (decoded.isEmpty()) {
					logger.error("No installation id in {} webhook payload, ignoring it", event);
					return;
				}
				PullRequestEvent pullRequest = decoded.get();
				ReconciliationOutcome outcome = signatureReconciler.reconcile(pullRequest);
				logger.info("{}#{} ({}): {}", pullRequest.repository(), pullRequest.number(), pullRequest.action(),
						outcome);
			}
			case ISSUE_COMMENT -> {
				Optional<IssueCommentEvent> decoded = decoder.decodeIssueComment(payload);
				if (decoded.isEmpty()) {
					logger.error("No installation id in {} webhook payload, ignoring it", event);
					return;
				}
				IssueCommentEvent comment = decoded.get();
				ResendOutcome outcome = resendCommandHandler.handle(comment);
				if (outcome != ResendOutcome.IGNORED) {
					logger.info("{}#{} resend: {}", comment.repository(), comment.number(), outcome);
				}
			}
			case PING -> logger.info("Received ping webhook");
			case UNSUPPORTED -> logger.debug("Ignoring {} webhook", event);
		}
	}

}
