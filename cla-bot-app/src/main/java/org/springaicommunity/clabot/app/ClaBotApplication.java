package org.springaicommunity.clabot.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * CLA bot web service.
 *
 * <p>
 * Receives GitHub pull request webhooks and Concord agreement webhooks and keeps each
 * pull request's CLA check in step with the contributor's agreement. Configuration comes
 * from environment variables, optionally through a {@code .env} file in the working
 * directory; see {@code application.yml} for the full list.
 */
@SpringBootApplication
public class ClaBotApplication {

	public static void main(String[] args) {
		SpringApplication.run(ClaBotApplication.class, args);
	}

}
