package org.springaicommunity.clabot;

import io.github.cdimascio.dotenv.Dotenv;
import io.github.cdimascio.dotenv.DotenvEntry;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Access to the {@code .env} file in the working directory. The file is loaded once and
 * cached for the lifetime of the process.
 */
public final class EnvironmentSupport {

	private static final Dotenv DOTENV = Dotenv.configure().ignoreIfMissing().ignoreIfMalformed().load();

	private EnvironmentSupport() {
	}

	/**
	 * Entries defined in the {@code .env} file only, without the system environment.
	 */
	public static Map<String, String> fileEntries() {
		Map<String, String> entries = new LinkedHashMap<>();
		for (DotenvEntry entry : DOTENV.entries(Dotenv.Filter.DECLARED_IN_ENV_FILE)) {
			entries.put(entry.getKey(), entry.getValue());
		}
		return entries;
	}

}
