/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.agent;

import java.util.Map;

import com.agentclientprotocol.gateway.spec.AcpSchema;

/**
 * Progress reported by the agent runtime while it works on a turn.
 *
 * @author Mark Pollack
 */
public sealed interface AgentEvent permits AgentEvent.MessageChunk, AgentEvent.ToolCallStarted,
		AgentEvent.ToolCallFinished, AgentEvent.ErrorReported, AgentEvent.TurnCompleted {

	/**
	 * Assistant content produced so far.
	 */
	record MessageChunk(AcpSchema.AcpMessage message) implements AgentEvent {

		public static MessageChunk text(String text) {
			return new MessageChunk(AcpSchema.AcpMessage.assistant(text));
		}

	}

	/**
	 * The agent is about to invoke a tool.
	 */
	record ToolCallStarted(String toolCallId, String name, Map<String, Object> arguments) implements AgentEvent {
	}

	/**
	 * A tool invocation returned.
	 */
	record ToolCallFinished(String toolCallId, String name, AcpSchema.ToolResult result) implements AgentEvent {
	}

	/**
	 * A non-fatal error the runtime wants the client to see. The turn continues.
	 */
	record ErrorReported(String message) implements AgentEvent {
	}

	/**
	 * The final result of the turn. Events after it are ignored.
	 */
	record TurnCompleted(AcpSchema.PromptResult result) implements AgentEvent {
	}

}
