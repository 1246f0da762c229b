/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.codec;

import com.agentclientprotocol.gateway.error.AcpException;

/**
 * A single line could not be decoded as JSON.
 *
 * @author Mark Pollack
 */
public class FrameDecodeException extends AcpException {

	private final long lineNumber;

	private final String line;

	public FrameDecodeException(long lineNumber, String line, Throwable cause) {
		super("Invalid JSON on line " + lineNumber + ": " + cause.getMessage(), cause);
		this.lineNumber = lineNumber;
		this.line = line;
	}

	public long getLineNumber() {
		return lineNumber;
	}

	public String getLine() {
		return line;
	}

}
