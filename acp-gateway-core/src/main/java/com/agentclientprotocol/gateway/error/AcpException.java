/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.error;

/**
 * Root of the gateway's unchecked exception hierarchy.
 *
 * @author Mark Pollack
 */
public class AcpException extends RuntimeException {

	public AcpException(String message) {
		super(message);
	}

	public AcpException(String message, Throwable cause) {
		super(message, cause);
	}

}
