package org.springaicommunity.clabot.app;

import org.springaicommunity.clabot.EnvironmentSupport;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

import java.util.HashMap;
import java.util.Map;

/**
 * Makes the variables of a {@code .env} file in the working directory visible to the
 * Spring environment. Real environment variables and system properties take precedence.
 */
public class DotenvEnvironmentPostProcessor implements EnvironmentPostProcessor {

	static final String PROPERTY_SOURCE_NAME = "dotenv";

	@Override
	public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
		Map<String, String> entries = EnvironmentSupport.fileEntries();
		if (entries.isEmpty()) {
			return;
		}
		environment.getPropertySources().addLast(new MapPropertySource(PROPERTY_SOURCE_NAME, new HashMap<>(entries)));
	}

}
