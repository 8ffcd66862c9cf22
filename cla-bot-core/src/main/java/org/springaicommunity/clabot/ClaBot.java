package org.springaicommunity.clabot;

/**
 * The wired CLA bot: the three event handlers plus the webhook decoding they need.
 *
 * @param signatureReconciler handles pull request events
 * @param completionReconciler handles agreement-service events
 * @param resendCommandHandler handles {@code /cla resend} comments
 * @param signatureVerifier verifies GitHub webhook signatures
 * @param gitHubDecoder decodes GitHub webhook bodies
 * @param concordDecoder decodes agreement-service webhook bodies
 */
public record ClaBot(SignatureReconciler signatureReconciler, CompletionReconciler completionReconciler,
		ResendCommandHandler resendCommandHandler, WebhookSignatureVerifier signatureVerifier,
		GitHubWebhookDecoder gitHubDecoder, ConcordWebhookDecoder concordDecoder) {

}
