/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.agentclientprotocol.gateway.client.AcpGatewayClient;
import com.agentclientprotocol.gateway.server.AcpGateway;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.test.InMemoryTransportPair;
import com.agentclientprotocol.gateway.tool.BashTool;
import com.agentclientprotocol.gateway.transport.StdioAcpTransport;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that threads started by the gateway never keep the JVM alive.
 *
 * @author Mark Pollack
 */
class CleanShutdownTest {

	private static final Duration TIMEOUT = Duration.ofSeconds(10);

	@Test
	void gatewayThreadsAreDaemonThreads() {
		AcpGateway gateway = AcpGateway.builder().tool(new BashTool()).sweepInterval(Duration.ofMillis(50)).build();
		gateway.start();
		InMemoryTransportPair pair = InMemoryTransportPair.create();
		gateway.serve(pair.serverTransport()).subscribe();
		AcpGatewayClient client = AcpGatewayClient.builder(pair.clientTransport()).requestTimeout(TIMEOUT).build();
		StdioAcpTransport stdio = new StdioAcpTransport(McpJsonMapper.getDefault(),
				new ByteArrayInputStream(new byte[0]), new ByteArrayOutputStream());

		try {
			client.newSession(new AcpSchema.NewSessionRequest(".")).block(TIMEOUT);
			client.callTool(new AcpSchema.CallToolRequest(BashTool.NAME, Map.of("command", "true"))).block(TIMEOUT);
			stdio.start(frame -> stdio.sendFrame(frame)).block(TIMEOUT);

			Set<Thread> gatewayThreads = Thread.getAllStackTraces()
				.keySet()
				.stream()
				.filter(thread -> thread.getName().startsWith("acp-"))
				.collect(Collectors.toSet());

			assertThat(gatewayThreads).isNotEmpty();
			assertThat(gatewayThreads).allSatisfy(thread -> assertThat(thread.isDaemon())
				.describedAs("Thread '%s' should be a daemon thread", thread.getName())
				.isTrue());
		}
		finally {
			client.closeGracefully().block(TIMEOUT);
			stdio.closeGracefully().block(TIMEOUT);
			gateway.closeGracefully().block(TIMEOUT);
		}
	}

}
