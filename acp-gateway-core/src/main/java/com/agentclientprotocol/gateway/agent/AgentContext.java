/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.agent;

import java.util.Map;

/**
 * Execution context handed to the agent runtime when a session is created.
 *
 * @param sessionId the owning session
 * @param workingDirectory directory the agent works in
 * @param metadata client metadata
 */
public record AgentContext(String sessionId, String workingDirectory, Map<String, Object> metadata) {
}
