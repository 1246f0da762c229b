/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.launcher;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.ServiceLoader;

import com.agentclientprotocol.gateway.agent.AgentRuntime;
import com.agentclientprotocol.gateway.agent.UnconfiguredAgentRuntime;
import com.agentclientprotocol.gateway.server.AcpGateway;
import com.agentclientprotocol.gateway.server.transport.WebSocketAcpServer;
import com.agentclientprotocol.gateway.tool.AcpTool;
import com.agentclientprotocol.gateway.tool.BashTool;
import com.agentclientprotocol.gateway.transport.StdioAcpTransport;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point. Builds the gateway from {@link GatewayConfig}, discovers the
 * agent runtime and extra tools with {@link ServiceLoader}, and serves either stdio or
 * WebSocket connections until the input ends or the process is stopped.
 *
 * @author Mark Pollack
 */
public final class AcpGatewayApplication {

	private static final Logger logger = LoggerFactory.getLogger(AcpGatewayApplication.class);

	private AcpGatewayApplication() {
	}

	public static void main(String[] args) {
		GatewayConfig config;
		try {
			config = GatewayConfig.load();
		}
		catch (IllegalArgumentException e) {
			logger.error("Invalid configuration: {}", e.getMessage());
			System.exit(2);
			return;
		}

		AcpGateway gateway = createGateway(config);
		gateway.start();
		Runtime.getRuntime().addShutdownHook(new Thread(() -> gateway.closeGracefully().block(), "acp-shutdown"));

		if (config.transport() == GatewayConfig.Transport.STDIO) {
			logger.info("Serving ACP over stdio");
			gateway.serve(new StdioAcpTransport(gateway.getJsonMapper())).block();
			gateway.closeGracefully().block();
			return;
		}

		WebSocketAcpServer server = new WebSocketAcpServer(gateway, config.host(), config.port(), config.path());
		Runtime.getRuntime().addShutdownHook(new Thread(() -> server.closeGracefully().block(), "acp-ws-shutdown"));
		server.start().block();
		server.awaitTermination().block();
	}

	/**
	 * Assembles the gateway the launcher serves.
	 * @param config the launcher settings
	 * @return a gateway that has not been started
	 */
	static AcpGateway createGateway(GatewayConfig config) {
		List<AcpTool> tools = new ArrayList<>();
		tools.add(new BashTool());
		for (AcpTool tool : ServiceLoader.load(AcpTool.class)) {
			if (BashTool.NAME.equals(tool.name())) {
				logger.warn("Ignoring discovered tool {} that shadows the built-in bash tool", tool.getClass().getName());
				continue;
			}
			tools.add(tool);
		}

		return AcpGateway.builder()
			.jsonMapper(McpJsonMapper.getDefault())
			.agentRuntime(discoverAgentRuntime())
			.tools(tools)
			.toolErrorHeuristic(config.toolErrorHeuristic())
			.defaultWorkingDirectory(config.workingDirectory())
			.maxSessions(config.maxSessions())
			.sessionTimeout(config.sessionTimeout())
			.sweepInterval(config.sweepInterval())
			.requestTimeout(config.requestTimeout())
			.build();
	}

	private static AgentRuntime discoverAgentRuntime() {
		Iterator<AgentRuntime> runtimes = ServiceLoader.load(AgentRuntime.class).iterator();
		if (!runtimes.hasNext()) {
			logger.warn("No AgentRuntime found on the class path, prompts will fail until one is installed");
			return new UnconfiguredAgentRuntime();
		}
		AgentRuntime runtime = runtimes.next();
		if (runtimes.hasNext()) {
			logger.warn("Several AgentRuntime implementations found, using {}", runtime.getClass().getName());
		}
		logger.info("Using agent runtime {}", runtime.getClass().getName());
		return runtime;
	}

}
