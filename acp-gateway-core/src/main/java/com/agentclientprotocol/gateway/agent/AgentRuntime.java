/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.agent;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The agent that produces assistant turns and tool calls. The gateway treats it as an
 * asynchronous producer of {@link AgentEvent}s and never inspects how it reasons.
 *
 * <p>
 * Implementations are discovered with {@link java.util.ServiceLoader} by the launcher, or
 * passed to {@code AcpGateway.builder()} directly.
 * </p>
 *
 * @author Mark Pollack
 */
public interface AgentRuntime {

	/**
	 * Prepares shared resources. Called once, on the first {@code initialize} request that
	 * reaches the gateway, and again only if that call failed.
	 * @return a Mono completing when ready
	 */
	default Mono<Void> initialize() {
		return Mono.empty();
	}

	/**
	 * Creates the execution context for a new session.
	 * @param context the session context
	 * @return a Mono completing when the context exists
	 */
	Mono<Void> createContext(AgentContext context);

	/**
	 * Drives one prompt to completion. Cancelling the subscription abandons the turn.
	 * @param turn the prompt
	 * @return the events of the turn, ideally ending with a
	 * {@link AgentEvent.TurnCompleted}
	 */
	Flux<AgentEvent> runTurn(AgentTurn turn);

	/**
	 * Asks the runtime to abandon the current turn of a session. Best effort.
	 * @param sessionId the session
	 * @return a Mono completing once the request is registered
	 */
	Mono<Void> cancel(String sessionId);

	/**
	 * Releases the context of a deleted or expired session.
	 * @param sessionId the session
	 * @return a Mono completing when released
	 */
	default Mono<Void> releaseContext(String sessionId) {
		return Mono.empty();
	}

}
