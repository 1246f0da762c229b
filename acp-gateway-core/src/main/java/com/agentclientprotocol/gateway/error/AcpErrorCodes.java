/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.error;

/**
 * Wire-stable error codes used in JSON-RPC error responses.
 *
 * <p>
 * The first band is the reserved JSON-RPC 2.0 range. The second band (-32000 to -32005)
 * carries gateway conditions: agent and tool failures, permission, session lookup and
 * unsupported operations.
 * </p>
 *
 * @author Mark Pollack
 */
public final class AcpErrorCodes {

	private AcpErrorCodes() {
	}

	// ---------------------------
	// JSON-RPC 2.0
	// ---------------------------

	/** Invalid JSON was received. */
	public static final int PARSE_ERROR = -32700;

	/** The JSON sent is not a valid Request object. */
	public static final int INVALID_REQUEST = -32600;

	/** The method does not exist or is not available. */
	public static final int METHOD_NOT_FOUND = -32601;

	/** Invalid method parameter(s). */
	public static final int INVALID_PARAMS = -32602;

	/** Internal JSON-RPC error. */
	public static final int INTERNAL_ERROR = -32603;

	// ---------------------------
	// Gateway
	// ---------------------------

	/** The agent runtime failed while processing a turn. */
	public static final int AGENT_ERROR = -32000;

	/** A tool could not be resolved or executed. */
	public static final int TOOL_ERROR = -32001;

	/** The operation is not permitted. */
	public static final int PERMISSION_DENIED = -32002;

	/** No active session exists for the given id. */
	public static final int SESSION_NOT_FOUND = -32003;

	/** The session timed out through inactivity. */
	public static final int SESSION_EXPIRED = -32004;

	/** The operation is not supported by this gateway. */
	public static final int UNSUPPORTED_OPERATION = -32005;

	/**
	 * Returns a short human-readable description for an error code.
	 * @param code the error code
	 * @return the description, or "Unknown error" for unrecognized codes
	 */
	public static String getDescription(int code) {
		return switch (code) {
			case PARSE_ERROR -> "Parse error";
			case INVALID_REQUEST -> "Invalid request";
			case METHOD_NOT_FOUND -> "Method not found";
			case INVALID_PARAMS -> "Invalid params";
			case INTERNAL_ERROR -> "Internal error";
			case AGENT_ERROR -> "Agent error";
			case TOOL_ERROR -> "Tool error";
			case PERMISSION_DENIED -> "Permission denied";
			case SESSION_NOT_FOUND -> "Session not found";
			case SESSION_EXPIRED -> "Session expired";
			case UNSUPPORTED_OPERATION -> "Unsupported operation";
			default -> "Unknown error";
		};
	}

}
