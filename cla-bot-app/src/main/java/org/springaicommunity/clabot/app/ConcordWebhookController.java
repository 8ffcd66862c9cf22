package org.springaicommunity.clabot.app;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.clabot.AgreementEvent;
import org.springaicommunity.clabot.CompletionReconciler;
import org.springaicommunity.clabot.ConcordWebhookDecoder;
import org.springaicommunity.clabot.FanOutReport;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Receives Concord agreement webhooks.
 */
@RestController
@RequestMapping("/concord")
public class ConcordWebhookController {

	private static final Logger logger = LoggerFactory.getLogger(ConcordWebhookController.class);

	private final ConcordWebhookDecoder decoder;

	private final CompletionReconciler completionReconciler;

	public ConcordWebhookController(ConcordWebhookDecoder decoder, CompletionReconciler completionReconciler) {
		this.decoder = decoder;
		this.completionReconciler = completionReconciler;
	}

	@PostMapping("/webhook")
	public ResponseEntity<Map<String, Object>> webhook(@RequestBody(required = false) byte @Nullable [] body) {
		try {
			AgreementEvent event = decoder.decode(body != null ? body : new byte[0]);
			logger.info("Received {} for agreement {} (event {})", event.eventName(), event.agreementRef(),
					event.eventId());
			FanOutReport report = completionReconciler.handle(event);
			if (!report.failed().isEmpty()) {
				logger.warn("Agreement {}: {} pull requests could not be updated: {}", report.agreementRef(),
						report.failed().size(), report.failed());
			}
			return ResponseEntity.ok(Map.of("success", true));
		}
		catch (RuntimeException e) {
			logger.error("Failed to handle Concord webhook: {}", e.getMessage(), e);
			return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
				.body(Map.of("error", "Internal server error"));
		}
	}

	@GetMapping("/health")
	public Map<String, Object> health() {
		return Map.of("status", "healthy", "message", "Concord webhook endpoint is ready", "timestamp",
				Instant.now().toString());
	}

}
