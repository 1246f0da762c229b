/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.agent;

import com.agentclientprotocol.gateway.error.AcpErrorCodes;
import com.agentclientprotocol.gateway.error.AcpProtocolException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runtime used when no agent is installed. Sessions and tools work; prompts fail with an
 * agent error.
 *
 * @author Mark Pollack
 */
public class UnconfiguredAgentRuntime implements AgentRuntime {

	@Override
	public Mono<Void> createContext(AgentContext context) {
		return Mono.empty();
	}

	@Override
	public Flux<AgentEvent> runTurn(AgentTurn turn) {
		return Flux.error(new AcpProtocolException(AcpErrorCodes.AGENT_ERROR, "No agent runtime configured"));
	}

	@Override
	public Mono<Void> cancel(String sessionId) {
		return Mono.empty();
	}

}
