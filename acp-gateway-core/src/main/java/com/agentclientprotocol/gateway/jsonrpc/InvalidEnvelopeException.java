/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.jsonrpc;

import com.agentclientprotocol.gateway.error.AcpErrorCodes;
import com.agentclientprotocol.gateway.error.AcpProtocolException;

/**
 * A decoded frame that is not a well-formed JSON-RPC 2.0 envelope.
 *
 * @author Mark Pollack
 */
public class InvalidEnvelopeException extends AcpProtocolException {

	/**
	 * What the frame looked like before validation failed. Determines whether a response
	 * can be sent back.
	 */
	public enum Kind {

		REQUEST, NOTIFICATION, RESPONSE

	}

	private final Kind kind;

	private final Object requestId;

	public InvalidEnvelopeException(Kind kind, Object requestId, String message) {
		super(AcpErrorCodes.INVALID_REQUEST, message);
		this.kind = kind;
		this.requestId = requestId;
	}

	public Kind getKind() {
		return kind;
	}

	/**
	 * Returns the id to echo in the error response, null when it was missing or invalid.
	 * @return the request id
	 */
	public Object getRequestId() {
		return requestId;
	}

}
