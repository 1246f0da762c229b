/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.error;

import com.agentclientprotocol.gateway.spec.AcpSchema;

/**
 * Exception carrying a JSON-RPC error code, message and optional data.
 *
 * <p>
 * Thrown by method handlers to produce a specific error response, and raised on the client
 * side when a response arrives with an {@code error} member. {@link #getMessage()} includes
 * the code for log readability; {@link #getErrorMessage()} is the bare message that goes on
 * the wire.
 * </p>
 *
 * @author Mark Pollack
 */
public class AcpProtocolException extends AcpException {

	private final int code;

	private final String errorMessage;

	private final Object data;

	public AcpProtocolException(AcpSchema.JSONRPCError error) {
		this(error.code(), error.message(), error.data());
	}

	public AcpProtocolException(int code, String message) {
		this(code, message, null);
	}

	public AcpProtocolException(int code, String message, Object data) {
		super("[" + code + "] " + message);
		this.code = code;
		this.errorMessage = message;
		this.data = data;
	}

	public static AcpProtocolException sessionNotFound(String sessionId) {
		return new AcpProtocolException(AcpErrorCodes.SESSION_NOT_FOUND, "Session '" + sessionId + "' not found");
	}

	public static AcpProtocolException sessionExpired(String sessionId) {
		return new AcpProtocolException(AcpErrorCodes.SESSION_EXPIRED, "Session '" + sessionId + "' has expired");
	}

	public static AcpProtocolException invalidParams(String message) {
		return new AcpProtocolException(AcpErrorCodes.INVALID_PARAMS, message);
	}

	public int getCode() {
		return code;
	}

	public String getErrorMessage() {
		return errorMessage;
	}

	public Object getData() {
		return data;
	}

	/**
	 * Converts this exception into the error member of a JSON-RPC response.
	 * @return the JSON-RPC error
	 */
	public AcpSchema.JSONRPCError toJsonRpcError() {
		return new AcpSchema.JSONRPCError(code, errorMessage, data);
	}

	public boolean isMethodNotFound() {
		return code == AcpErrorCodes.METHOD_NOT_FOUND;
	}

	public boolean isInvalidParams() {
		return code == AcpErrorCodes.INVALID_PARAMS;
	}

	public boolean isInternalError() {
		return code == AcpErrorCodes.INTERNAL_ERROR;
	}

	public boolean isAgentError() {
		return code == AcpErrorCodes.AGENT_ERROR;
	}

	public boolean isToolError() {
		return code == AcpErrorCodes.TOOL_ERROR;
	}

	public boolean isSessionNotFound() {
		return code == AcpErrorCodes.SESSION_NOT_FOUND;
	}

	public boolean isSessionExpired() {
		return code == AcpErrorCodes.SESSION_EXPIRED;
	}

}
