/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.agent;

import java.util.Map;

/**
 * One user prompt to be driven to completion by the agent runtime.
 *
 * @param sessionId the owning session
 * @param message the user message
 * @param mode the session mode in effect
 * @param model the model in effect
 * @param workingDirectory the session working directory
 * @param metadata per-prompt metadata, never null
 */
public record AgentTurn(String sessionId, String message, String mode, String model, String workingDirectory,
		Map<String, Object> metadata) {

	public AgentTurn {
		metadata = metadata == null ? Map.of() : metadata;
	}

}
