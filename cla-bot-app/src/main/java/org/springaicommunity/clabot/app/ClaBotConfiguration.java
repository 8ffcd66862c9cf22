package org.springaicommunity.clabot.app;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.clabot.AgreementClient;
import org.springaicommunity.clabot.AgreementRecordRepository;
import org.springaicommunity.clabot.AgreementServiceException;
import org.springaicommunity.clabot.AgreementTemplate;
import org.springaicommunity.clabot.ClaBot;
import org.springaicommunity.clabot.ClaBotBuilder;
import org.springaicommunity.clabot.ClaProperties;
import org.springaicommunity.clabot.CompletionReconciler;
import org.springaicommunity.clabot.ConcordAgreementClient;
import org.springaicommunity.clabot.ConcordProperties;
import org.springaicommunity.clabot.ConcordWebhookDecoder;
import org.springaicommunity.clabot.GitHubAppProperties;
import org.springaicommunity.clabot.GitHubAppTokenManager;
import org.springaicommunity.clabot.GitHubPlatformClient;
import org.springaicommunity.clabot.GitHubWebhookDecoder;
import org.springaicommunity.clabot.InstallationClientCache;
import org.springaicommunity.clabot.JdbcAgreementRecordRepository;
import org.springaicommunity.clabot.ObjectMapperFactory;
import org.springaicommunity.clabot.PlatformClient;
import org.springaicommunity.clabot.ResendCommandHandler;
import org.springaicommunity.clabot.SignatureReconciler;
import org.springaicommunity.clabot.WebhookSignatureVerifier;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;

/**
 * Spring configuration binding the settings and wiring the bot.
 *
 * <p>
 * Settings are validated while the context starts, so a missing credential or an
 * unreadable private key stops the service before it accepts webhooks.
 */
@Configuration
public class ClaBotConfiguration {

	private static final Logger logger = LoggerFactory.getLogger(ClaBotConfiguration.class);

	@Bean
	@ConfigurationProperties("cla-bot.cla")
	public ClaProperties claProperties() {
		return new ClaProperties();
	}

	@Bean
	@ConfigurationProperties("cla-bot.github")
	public GitHubAppProperties gitHubAppProperties() {
		return new GitHubAppProperties();
	}

	@Bean
	@ConfigurationProperties("cla-bot.concord")
	public ConcordProperties concordProperties() {
		return new ConcordProperties();
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public AgreementRecordRepository agreementRecordRepository(JdbcTemplate jdbcTemplate) {
		return new JdbcAgreementRecordRepository(jdbcTemplate);
	}

	@Bean
	public GitHubAppTokenManager gitHubAppTokenManager(GitHubAppProperties properties) {
		properties.validate();
		return GitHubAppTokenManager.fromProperties(properties);
	}

	@Bean
	public PlatformClient platformClient(GitHubAppTokenManager tokenManager, GitHubAppProperties properties,
			ObjectMapper objectMapper) {
		return new GitHubPlatformClient(InstallationClientCache.create(tokenManager, properties),
				tokenManager::listInstallationIds, objectMapper);
	}

	@Bean
	public AgreementClient agreementClient(ConcordProperties properties, ClaProperties claProperties,
			ObjectMapper objectMapper) {
		properties.validate();
		return new ConcordAgreementClient(properties, claProperties.getOrganizationName(), objectMapper);
	}

	@Bean
	public ClaBot claBot(ClaProperties claProperties, GitHubAppProperties gitHubAppProperties,
			AgreementRecordRepository records, PlatformClient platformClient, AgreementClient agreementClient,
			ObjectMapper objectMapper) {
		return ClaBotBuilder.create()
			.claProperties(claProperties)
			.gitHubAppProperties(gitHubAppProperties)
			.records(records)
			.platformClient(platformClient)
			.agreementClient(agreementClient)
			.objectMapper(objectMapper)
			.build();
	}

	@Bean
	public SignatureReconciler signatureReconciler(ClaBot claBot) {
		return claBot.signatureReconciler();
	}

	@Bean
	public CompletionReconciler completionReconciler(ClaBot claBot) {
		return claBot.completionReconciler();
	}

	@Bean
	public ResendCommandHandler resendCommandHandler(ClaBot claBot) {
		return claBot.resendCommandHandler();
	}

	@Bean
	public WebhookSignatureVerifier webhookSignatureVerifier(ClaBot claBot) {
		return claBot.signatureVerifier();
	}

	@Bean
	public GitHubWebhookDecoder gitHubWebhookDecoder(ClaBot claBot) {
		return claBot.gitHubDecoder();
	}

	@Bean
	public ConcordWebhookDecoder concordWebhookDecoder(ClaBot claBot) {
		return claBot.concordDecoder();
	}

	/**
	 * Warn at startup when the configured agreement template is not an automated template
	 * of the organization; agreement creation would fail for every contributor.
	 */
	@Bean
	public ApplicationRunner agreementTemplateCheck(AgreementClient agreementClient, ConcordProperties properties) {
		return args -> {
			try {
				List<AgreementTemplate> templates = agreementClient.listTemplates();
				boolean found = templates.stream().anyMatch(t -> t.id().equals(properties.getTemplateId()));
				if (found) {
					logger.info("Agreement template {} is available", properties.getTemplateId());
				}
				else {
					logger.warn("Agreement template {} not found among {} automated templates: {}",
							properties.getTemplateId(), templates.size(), templates);
				}
			}
			catch (AgreementServiceException e) {
				logger.warn("Could not list agreement templates (status {}): {}", e.getStatusCode(), e.getMessage());
			}
		};
	}

}
