/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.session;

import com.agentclientprotocol.gateway.error.AcpException;

/**
 * A session could not be created.
 *
 * @author Mark Pollack
 */
public class SessionAdmissionException extends AcpException {

	public enum Reason {

		/** The configured maximum number of sessions is reached. */
		CAPACITY,

		/** The generated id is already in use. */
		DUPLICATE_ID

	}

	private final Reason reason;

	public SessionAdmissionException(Reason reason, String message) {
		super(message);
		this.reason = reason;
	}

	public Reason getReason() {
		return reason;
	}

}
