package org.springaicommunity.clabot.app;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ServiceInfoController.class)
@TestPropertySource(properties = "cla-bot.version=9.9.9-test")
@DisplayName("ServiceInfoController Tests")
class ServiceInfoControllerTest {

	@Autowired
	private MockMvc mockMvc;

	@Test
	@DisplayName("Should report service health with the version")
	void shouldReportHealth() throws Exception {
		mockMvc.perform(get("/health"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.status").value("healthy"))
			.andExpect(jsonPath("$.service").value("cla-bot"))
			.andExpect(jsonPath("$.version").value("9.9.9-test"));
	}

	@Test
	@DisplayName("Should list the webhook endpoints")
	void shouldDescribeService() throws Exception {
		mockMvc.perform(get("/"))
			.andExpect(status().isOk())
			.andExpect(jsonPath("$.endpoints").value(hasItem("POST /github/webhook")))
			.andExpect(jsonPath("$.endpoints").value(hasItem("POST /concord/webhook")));
	}

}
