/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.server;

import java.util.List;

import com.agentclientprotocol.gateway.spec.AcpSchema;

/**
 * Static values the method table reports to clients and the limits it enforces.
 *
 * @param serverInfo gateway name and version
 * @param capabilities capabilities offered before negotiation
 * @param availableModels models listed by {@code session/new}
 * @param availableModes modes listed by {@code session/new}
 * @param maxToolCallsPerTurn tool calls allowed in one prompt turn
 * @param defaultWorkingDirectory directory used when a session does not name one
 */
public record GatewaySettings(AcpSchema.ServerInfo serverInfo, AcpSchema.AgentCapabilities capabilities,
		List<String> availableModels, List<String> availableModes, int maxToolCallsPerTurn,
		String defaultWorkingDirectory) {

	public static final List<String> DEFAULT_MODELS = List.of("qwen3:latest", "gpt-4", "claude-3-sonnet");

	public static final List<String> DEFAULT_MODES = List.of("execute", "plan", "safe");

	public static final int DEFAULT_MAX_TOOL_CALLS_PER_TURN = 50;

}
