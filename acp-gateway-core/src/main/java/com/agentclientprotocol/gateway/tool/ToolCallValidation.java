/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of {@link ToolRegistry#validateToolCall}.
 *
 * @param valid whether the call would be accepted
 * @param error the reason when invalid
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolCallValidation(@JsonProperty("valid") boolean valid, @JsonProperty("error") String error) {

	public static ToolCallValidation ok() {
		return new ToolCallValidation(true, null);
	}

	public static ToolCallValidation invalid(String error) {
		return new ToolCallValidation(false, error);
	}

}
