/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.session;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate figures computed from the registered sessions on each call.
 *
 * @author Mark Pollack
 */
public record SessionStats(@JsonProperty("active_sessions") int activeSessions,
		@JsonProperty("max_sessions") int maxSessions, @JsonProperty("total_messages") long totalMessages,
		@JsonProperty("total_tool_calls") long totalToolCalls,
		@JsonProperty("session_timeout") long sessionTimeoutSeconds) {
}
