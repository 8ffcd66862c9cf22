package org.springaicommunity.clabot;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabase;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;

import java.time.Clock;

/**
 * In-memory H2 database with the production schema, one per test.
 */
final class TestDatabase implements AutoCloseable {

	private final EmbeddedDatabase database;

	TestDatabase() {
		this.database = new EmbeddedDatabaseBuilder().generateUniqueName(true)
			.setType(EmbeddedDatabaseType.H2)
			.addScript("db/cla-schema.sql")
			.build();
	}

	JdbcAgreementRecordRepository repository(Clock clock) {
		return new JdbcAgreementRecordRepository(new JdbcTemplate(database), clock);
	}

	EmbeddedDatabase dataSource() {
		return database;
	}

	@Override
	public void close() {
		database.shutdown();
	}

}
