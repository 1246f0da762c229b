/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Registry figures reported by {@link ToolRegistry#getToolStats()}.
 */
public record ToolStats(@JsonProperty("total_tools") int totalTools, @JsonProperty("cached_tools") int cachedTools,
		@JsonProperty("tool_names") List<String> toolNames) {
}
