package org.springaicommunity.clabot.app;

import org.springaicommunity.clabot.ConcordWebhookDecoder;
import org.springaicommunity.clabot.GitHubWebhookDecoder;
import org.springaicommunity.clabot.ObjectMapperFactory;
import org.springaicommunity.clabot.WebhookSignatureVerifier;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Real signature verification and decoding for controller slice tests.
 */
@TestConfiguration
class WebhookTestConfiguration {

	static final String SECRET = "test-secret";

	@Bean
	WebhookSignatureVerifier webhookSignatureVerifier() {
		return new WebhookSignatureVerifier(SECRET);
	}

	@Bean
	GitHubWebhookDecoder gitHubWebhookDecoder() {
		return new GitHubWebhookDecoder(ObjectMapperFactory.create());
	}

	@Bean
	ConcordWebhookDecoder concordWebhookDecoder() {
		return new ConcordWebhookDecoder(ObjectMapperFactory.create());
	}

}
