/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.streaming;

import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpSchema.SessionUpdate;
import com.agentclientprotocol.gateway.spec.AcpSchema.SessionUpdateType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Emits {@code session/update} notifications for one prompt turn.
 *
 * <p>
 * Each update is one notification frame tagged with the session id. The notifier is
 * closed by {@link #complete} or {@link #cancelled()}; later updates are dropped. Callers
 * chain the returned Monos so updates reach the transport in the order they were produced.
 * </p>
 *
 * @author Mark Pollack
 */
public class SessionUpdateNotifier {

	private static final Logger logger = LoggerFactory.getLogger(SessionUpdateNotifier.class);

	private final JsonRpcSession session;

	private final String sessionId;

	private final AtomicBoolean active = new AtomicBoolean(true);

	public SessionUpdateNotifier(JsonRpcSession session, String sessionId) {
		this.session = session;
		this.sessionId = sessionId;
	}

	public String getSessionId() {
		return sessionId;
	}

	public boolean isActive() {
		return active.get();
	}

	public Mono<Void> message(AcpSchema.AcpMessage message) {
		return send(update(SessionUpdateType.MESSAGE).message(message));
	}

	public Mono<Void> toolCall(String toolCallId, String name, Map<String, Object> arguments) {
		return send(update(SessionUpdateType.TOOL_CALL)
			.toolCall(new AcpSchema.ToolCallUpdate(toolCallId, name, arguments)));
	}

	public Mono<Void> toolResult(String toolCallId, String name, AcpSchema.ToolResult result) {
		return send(update(SessionUpdateType.TOOL_RESULT)
			.toolResult(new AcpSchema.ToolResultUpdate(toolCallId, name, result)));
	}

	public Mono<Void> error(String error) {
		return send(update(SessionUpdateType.ERROR).error(error));
	}

	/**
	 * Sends the final result and closes the notifier.
	 * @param result the prompt result
	 * @return a Mono completing once the frame is queued
	 */
	public Mono<Void> complete(AcpSchema.PromptResult result) {
		return sendFinal(update(SessionUpdateType.COMPLETE).result(result));
	}

	public Mono<Void> cancelled() {
		return sendFinal(update(SessionUpdateType.CANCELLED));
	}

	private Mono<Void> send(UpdateBuilder update) {
		return Mono.defer(() -> {
			if (!active.get()) {
				logger.debug("Dropping {} update for closed session stream {}", update.type, sessionId);
				return Mono.empty();
			}
			return session.sendNotification(AcpSchema.METHOD_SESSION_UPDATE, update.build());
		});
	}

	private Mono<Void> sendFinal(UpdateBuilder update) {
		return Mono.defer(() -> {
			if (!active.compareAndSet(true, false)) {
				return Mono.empty();
			}
			return session.sendNotification(AcpSchema.METHOD_SESSION_UPDATE, update.build());
		});
	}

	private UpdateBuilder update(SessionUpdateType type) {
		return new UpdateBuilder(sessionId, type);
	}

	private static final class UpdateBuilder {

		private final String sessionId;

		private final SessionUpdateType type;

		private AcpSchema.AcpMessage message;

		private AcpSchema.ToolCallUpdate toolCall;

		private AcpSchema.ToolResultUpdate toolResult;

		private String error;

		private AcpSchema.PromptResult result;

		UpdateBuilder(String sessionId, SessionUpdateType type) {
			this.sessionId = sessionId;
			this.type = type;
		}

		UpdateBuilder message(AcpSchema.AcpMessage message) {
			this.message = message;
			return this;
		}

		UpdateBuilder toolCall(AcpSchema.ToolCallUpdate toolCall) {
			this.toolCall = toolCall;
			return this;
		}

		UpdateBuilder toolResult(AcpSchema.ToolResultUpdate toolResult) {
			this.toolResult = toolResult;
			return this;
		}

		UpdateBuilder error(String error) {
			this.error = error;
			return this;
		}

		UpdateBuilder result(AcpSchema.PromptResult result) {
			this.result = result;
			return this;
		}

		SessionUpdate build() {
			return new SessionUpdate(sessionId, type, message, toolCall, toolResult, error, result);
		}

	}

}
