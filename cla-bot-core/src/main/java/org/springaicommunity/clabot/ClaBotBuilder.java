package org.springaicommunity.clabot;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;
import java.time.Clock;

/**
 * Builder for wiring the CLA bot without Spring's application context.
 *
 * <pre>
 * {@code
 * // Real clients, records in a JDBC data source
 * ClaBot bot = ClaBotBuilder.create()
 *     .claProperties(claProperties)
 *     .gitHubAppProperties(gitHubAppProperties)
 *     .concordProperties(concordProperties)
 *     .dataSource(dataSource)
 *     .build();
 *
 * // With mocked clients
 * ClaBot bot = ClaBotBuilder.create()
 *     .webhookSecret("secret")
 *     .records(repository)
 *     .platformClient(mock(PlatformClient.class))
 *     .agreementClient(mock(AgreementClient.class))
 *     .build();
 * }
 * </pre>
 */
public class ClaBotBuilder {

	private ClaProperties claProperties = new ClaProperties();

	private GitHubAppProperties gitHubAppProperties = new GitHubAppProperties();

	private ConcordProperties concordProperties = new ConcordProperties();

	private @Nullable ObjectMapper objectMapper;

	private @Nullable AgreementRecordRepository records;

	private @Nullable DataSource dataSource;

	private @Nullable PlatformClient platformClient;

	private @Nullable AgreementClient agreementClient;

	private Clock clock = Clock.systemUTC();

	private ClaBotBuilder() {
	}

	public static ClaBotBuilder create() {
		return new ClaBotBuilder();
	}

	public ClaBotBuilder claProperties(@Nullable ClaProperties properties) {
		if (properties != null) {
			this.claProperties = properties;
		}
		return this;
	}

	public ClaBotBuilder gitHubAppProperties(@Nullable GitHubAppProperties properties) {
		if (properties != null) {
			this.gitHubAppProperties = properties;
		}
		return this;
	}

	public ClaBotBuilder concordProperties(@Nullable ConcordProperties properties) {
		if (properties != null) {
			this.concordProperties = properties;
		}
		return this;
	}

	/**
	 * Set the webhook secret directly, for setups that supply their own clients.
	 */
	public ClaBotBuilder webhookSecret(String secret) {
		this.gitHubAppProperties.setWebhookSecret(secret);
		return this;
	}

	public ClaBotBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set the record store. Takes precedence over {@link #dataSource(DataSource)}.
	 */
	public ClaBotBuilder records(@Nullable AgreementRecordRepository records) {
		this.records = records;
		return this;
	}

	/**
	 * Store records in this database. The schema from {@code db/cla-schema.sql} must be
	 * applied already.
	 */
	public ClaBotBuilder dataSource(@Nullable DataSource dataSource) {
		this.dataSource = dataSource;
		return this;
	}

	/**
	 * Set a custom platform client. When set, no GitHub App credentials are needed.
	 */
	public ClaBotBuilder platformClient(@Nullable PlatformClient platformClient) {
		this.platformClient = platformClient;
		return this;
	}

	/**
	 * Set a custom agreement client. When set, no agreement service settings are needed.
	 */
	public ClaBotBuilder agreementClient(@Nullable AgreementClient agreementClient) {
		this.agreementClient = agreementClient;
		return this;
	}

	public ClaBotBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build the bot.
	 * @return the wired bot
	 * @throws IllegalStateException if required settings are missing
	 */
	public ClaBot build() {
		claProperties.validate();
		if (gitHubAppProperties.getWebhookSecret() == null || gitHubAppProperties.getWebhookSecret().isBlank()) {
			throw new IllegalStateException("GitHub webhook secret is required");
		}
		ObjectMapper mapper = this.objectMapper != null ? this.objectMapper : ObjectMapperFactory.create();
		AgreementRecordRepository store = buildRecords();
		PlatformClient platform = this.platformClient != null ? this.platformClient : buildPlatformClient(mapper);
		AgreementClient agreementsClient = this.agreementClient != null ? this.agreementClient
				: buildAgreementClient(mapper);

		return new ClaBot(new SignatureReconciler(store, platform, agreementsClient, claProperties, clock),
				new CompletionReconciler(store, platform, claProperties, clock),
				new ResendCommandHandler(store, platform, agreementsClient, claProperties),
				new WebhookSignatureVerifier(gitHubAppProperties.getWebhookSecret()), new GitHubWebhookDecoder(mapper),
				new ConcordWebhookDecoder(mapper));
	}

	private AgreementRecordRepository buildRecords() {
		if (records != null) {
			return records;
		}
		if (dataSource == null) {
			throw new IllegalStateException("A record store is required. Call records() or dataSource() first.");
		}
		return new JdbcAgreementRecordRepository(new JdbcTemplate(dataSource), clock);
	}

	private PlatformClient buildPlatformClient(ObjectMapper mapper) {
		gitHubAppProperties.validate();
		GitHubAppTokenManager tokenManager = GitHubAppTokenManager.fromProperties(gitHubAppProperties);
		return new GitHubPlatformClient(InstallationClientCache.create(tokenManager, gitHubAppProperties),
				tokenManager::listInstallationIds, mapper);
	}

	private AgreementClient buildAgreementClient(ObjectMapper mapper) {
		concordProperties.validate();
		return new ConcordAgreementClient(concordProperties, claProperties.getOrganizationName(), mapper, clock);
	}

}
