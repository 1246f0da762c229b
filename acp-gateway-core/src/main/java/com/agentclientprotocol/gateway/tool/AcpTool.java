/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.tool;

import java.util.List;
import java.util.Map;

import com.agentclientprotocol.gateway.spec.AcpSchema;

/**
 * A tool the gateway exposes through {@code tools/list} and {@code tools/call}.
 *
 * <p>
 * {@link #invoke(Map)} runs on a gateway worker thread and may block. Returning an
 * {@link AcpSchema.ToolResult} reports success or failure explicitly; any other value is
 * converted to text and classified by {@link ToolRegistry}.
 * </p>
 *
 * @author Mark Pollack
 */
public interface AcpTool {

	String name();

	String description();

	/**
	 * Declares the tool's parameters. Parameter names, types, required flags, defaults
	 * and allowed values are published unchanged in the tool descriptor.
	 * @return the parameters in declaration order
	 */
	List<AcpSchema.ToolParameter> parameters();

	/**
	 * Executes the tool.
	 * @param arguments the call arguments after context injection
	 * @return the raw output
	 * @throws Exception if the tool fails
	 */
	Object invoke(Map<String, Object> arguments) throws Exception;

}
