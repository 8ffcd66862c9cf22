package org.springaicommunity.clabot;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Null-safe navigation of Jackson trees. Missing and JSON {@code null} nodes are both
 * reported as absent.
 */
public class JsonNodeUtils {

	private static final Logger logger = LoggerFactory.getLogger(JsonNodeUtils.class);

	public Optional<String> getString(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) ? Optional.empty() : Optional.of(target.asText());
	}

	public Optional<Integer> getInt(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) || !target.canConvertToInt() ? Optional.empty() : Optional.of(target.asInt());
	}

	public Optional<Long> getLong(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		return isAbsent(target) || !target.canConvertToLong() ? Optional.empty() : Optional.of(target.asLong());
	}

	public Optional<Instant> getInstant(JsonNode node, String... path) {
		return getString(node, path).flatMap(str -> {
			try {
				return Optional.of(Instant.parse(str));
			}
			catch (DateTimeParseException e) {
				logger.warn("Failed to parse timestamp: {}", str);
				return Optional.empty();
			}
		});
	}

	public boolean has(JsonNode node, String... path) {
		return !isAbsent(navigate(node, path));
	}

	public List<JsonNode> getArray(JsonNode node, String... path) {
		JsonNode target = navigate(node, path);
		if (target.isArray()) {
			List<JsonNode> result = new ArrayList<>();
			target.forEach(result::add);
			return result;
		}
		return List.of();
	}

	private static JsonNode navigate(JsonNode node, String... path) {
		JsonNode target = node;
		for (String p : path) {
			target = target.path(p);
		}
		return target;
	}

	private static boolean isAbsent(JsonNode node) {
		return node.isMissingNode() || node.isNull();
	}

}
