/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable snapshot of a session. New snapshots are produced by {@link SessionManager}
 * only.
 *
 * @param sessionId opaque unique token
 * @param workingDirectory directory tools run in
 * @param createdAt creation time
 * @param lastActivity time of the last operation scoped to this session
 * @param mode agent mode, for example {@code execute}
 * @param model model identifier
 * @param metadata client-supplied metadata
 * @param active false once cancelled
 * @param messageCount prompts processed
 * @param toolCallCount tool calls made
 * @author Mark Pollack
 */
public record GatewaySession(String sessionId, String workingDirectory, Instant createdAt, Instant lastActivity,
		String mode, String model, Map<String, Object> metadata, boolean active, int messageCount,
		int toolCallCount) {

	public GatewaySession {
		metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
	}

	GatewaySession touch(Instant now) {
		return new GatewaySession(sessionId, workingDirectory, createdAt, now, mode, model, metadata, active,
				messageCount, toolCallCount);
	}

	GatewaySession apply(SessionChanges changes, Instant now) {
		return new GatewaySession(sessionId, workingDirectory, createdAt, now,
				changes.mode() != null ? changes.mode() : mode, changes.model() != null ? changes.model() : model,
				changes.metadata() != null ? changes.metadata() : metadata,
				changes.active() != null ? changes.active() : active, messageCount + changes.messageIncrement(),
				toolCallCount + changes.toolCallIncrement());
	}

	/**
	 * Returns whether the session has been idle for longer than the given timeout.
	 * @param now the current time
	 * @param timeout the idle timeout
	 * @return true if expired
	 */
	public boolean isExpired(Instant now, Duration timeout) {
		return Duration.between(lastActivity, now).compareTo(timeout) > 0;
	}

}
