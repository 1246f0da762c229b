/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.streaming;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.test.MockAcpTransport;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.assertj.core.api.InstanceOfAssertFactories;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SessionUpdateNotifier}.
 */
class SessionUpdateNotifierTest {

	private static final Duration TIMEOUT = Duration.ofSeconds(5);

	private static final TypeRef<Map<String, Object>> MAP_TYPE_REF = new TypeRef<>() {
	};

	private final McpJsonMapper jsonMapper = McpJsonMapper.getDefault();

	private final MockAcpTransport transport = new MockAcpTransport();

	private final JsonRpcSession session = new JsonRpcSession("notifier-test", TIMEOUT, transport, jsonMapper,
			Map.of(), Map.of());

	@AfterEach
	void tearDown() {
		session.close();
	}

	@Test
	void updatesAreTaggedWithSessionIdInOrder() throws IOException {
		SessionUpdateNotifier notifier = new SessionUpdateNotifier(session, "s-1");

		notifier.message(AcpSchema.AcpMessage.assistant("thinking"))
			.then(notifier.toolCall("call-1", "bash_tool", Map.of("command", "ls")))
			.then(notifier.toolResult("call-1", "bash_tool", AcpSchema.ToolResult.text("a.txt", false)))
			.then(notifier.complete(new AcpSchema.PromptResult(AcpSchema.AcpMessage.assistant("done"),
					AcpSchema.StopReason.COMPLETION)))
			.block(TIMEOUT);

		List<Map<String, Object>> params = sentParams();
		assertThat(params).extracting(p -> p.get("type"))
			.containsExactly("message", "tool_call", "tool_result", "complete");
		assertThat(params).allSatisfy(p -> assertThat(p).containsEntry("session_id", "s-1"));
		assertThat(params.get(1)).extractingByKey("tool_call")
			.isEqualTo(Map.of("id", "call-1", "name", "bash_tool", "arguments", Map.of("command", "ls")));
		assertThat(params.get(3)).extractingByKey("result")
			.asInstanceOf(InstanceOfAssertFactories.MAP)
			.containsEntry("stop_reason", "completion");
	}

	@Test
	void updatesAfterCompletionAreDropped() throws IOException {
		SessionUpdateNotifier notifier = new SessionUpdateNotifier(session, "s-2");

		notifier.complete(new AcpSchema.PromptResult(null, AcpSchema.StopReason.COMPLETION))
			.then(notifier.message(AcpSchema.AcpMessage.assistant("late")))
			.then(notifier.error("late error"))
			.then(notifier.cancelled())
			.block(TIMEOUT);

		assertThat(notifier.isActive()).isFalse();
		assertThat(sentParams()).extracting(p -> p.get("type")).containsExactly("complete");
	}

	@Test
	void cancelledClosesTheStream() throws IOException {
		SessionUpdateNotifier notifier = new SessionUpdateNotifier(session, "s-3");

		notifier.error("interrupted").then(notifier.cancelled()).block(TIMEOUT);

		List<Map<String, Object>> params = sentParams();
		assertThat(params).extracting(p -> p.get("type")).containsExactly("error", "cancelled");
		assertThat(params.get(0)).containsEntry("error", "interrupted");
		assertThat(notifier.isActive()).isFalse();
	}

	private List<Map<String, Object>> sentParams() throws IOException {
		List<Map<String, Object>> params = new ArrayList<>();
		for (String frame : transport.getSentFrames()) {
			Map<String, Object> notification = jsonMapper.readValue(frame, MAP_TYPE_REF);
			assertThat(notification).containsEntry("method", AcpSchema.METHOD_SESSION_UPDATE);
			@SuppressWarnings("unchecked")
			Map<String, Object> p = (Map<String, Object>) notification.get("params");
			params.add(p);
		}
		return params;
	}

}
