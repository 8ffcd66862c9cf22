package org.springaicommunity.clabot.app;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service health and a short description of the endpoints.
 */
@RestController
public class ServiceInfoController {

	private static final String SERVICE_NAME = "cla-bot";

	private final String version;

	public ServiceInfoController(@Value("${cla-bot.version:unknown}") String version) {
		this.version = version;
	}

	@GetMapping("/health")
	public Map<String, Object> health() {
		Map<String, Object> health = new LinkedHashMap<>();
		health.put("status", "healthy");
		health.put("service", SERVICE_NAME);
		health.put("version", version);
		health.put("timestamp", Instant.now().toString());
		return health;
	}

	@GetMapping("/")
	public Map<String, Object> info() {
		Map<String, Object> info = new LinkedHashMap<>();
		info.put("name", SERVICE_NAME);
		info.put("description", "Contributor License Agreement enforcement for GitHub pull requests");
		info.put("version", version);
		info.put("endpoints", List.of("POST /github/webhook", "POST /concord/webhook", "GET /concord/health",
				"GET /health"));
		return info;
	}

}
