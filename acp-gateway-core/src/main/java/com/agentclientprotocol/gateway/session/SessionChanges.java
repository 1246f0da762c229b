/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.session;

import java.util.Map;

/**
 * A partial update applied by {@link SessionManager#update(String, SessionChanges)}. Null
 * members leave the field unchanged; the increments are added to the counters.
 *
 * @author Mark Pollack
 */
public record SessionChanges(String mode, String model, Map<String, Object> metadata, Boolean active,
		int messageIncrement, int toolCallIncrement) {

	public static SessionChanges none() {
		return new SessionChanges(null, null, null, null, 0, 0);
	}

	public static SessionChanges mode(String mode) {
		return none().withMode(mode);
	}

	public static SessionChanges model(String model) {
		return none().withModel(model);
	}

	public static SessionChanges deactivate() {
		return new SessionChanges(null, null, null, false, 0, 0);
	}

	public static SessionChanges messageProcessed() {
		return new SessionChanges(null, null, null, null, 1, 0);
	}

	public static SessionChanges toolCalled() {
		return new SessionChanges(null, null, null, null, 0, 1);
	}

	public SessionChanges withMode(String mode) {
		return new SessionChanges(mode, model, metadata, active, messageIncrement, toolCallIncrement);
	}

	public SessionChanges withModel(String model) {
		return new SessionChanges(mode, model, metadata, active, messageIncrement, toolCallIncrement);
	}

}
