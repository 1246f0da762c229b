/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.capabilities;

import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpSchema.AgentCapabilities;
import com.agentclientprotocol.gateway.spec.AcpSchema.FileSystemCapabilities;
import com.agentclientprotocol.gateway.spec.AcpSchema.PromptCapabilities;
import com.agentclientprotocol.gateway.spec.AcpSchema.TerminalCapabilities;

/**
 * Result of capability negotiation during {@code initialize}.
 *
 * <p>
 * A flag is enabled when the gateway offers it and the client, if it declared the flag at
 * all, accepts it. Flags or groups the client leaves out keep the gateway's value.
 * Negotiation is a pure function of its inputs, so repeated {@code initialize} calls with
 * the same request yield the same capabilities.
 * </p>
 *
 * @param capabilities the effective capabilities
 * @param protocolVersionMatched whether the client asked for the gateway's protocol version
 * @author Mark Pollack
 */
public record NegotiatedCapabilities(AgentCapabilities capabilities, boolean protocolVersionMatched) {

	/**
	 * Negotiates the capabilities for an initialize request.
	 * @param server the capabilities the gateway offers
	 * @param request the client's initialize request, may be null
	 * @return the negotiated capabilities
	 */
	public static NegotiatedCapabilities negotiate(AgentCapabilities server, AcpSchema.InitializeRequest request) {
		AgentCapabilities client = request != null ? request.capabilities() : null;
		boolean versionMatched = request == null || request.protocolVersion() == null
				|| AcpSchema.PROTOCOL_VERSION.equals(request.protocolVersion());
		return new NegotiatedCapabilities(intersect(server, client), versionMatched);
	}

	static AgentCapabilities intersect(AgentCapabilities server, AgentCapabilities client) {
		if (client == null) {
			return server;
		}
		return new AgentCapabilities(intersect(server.prompt(), client.prompt()),
				intersect(server.fs(), client.fs()), intersect(server.terminal(), client.terminal()));
	}

	private static PromptCapabilities intersect(PromptCapabilities server, PromptCapabilities client) {
		if (server == null || client == null) {
			return server;
		}
		return new PromptCapabilities(and(server.image(), client.image()),
				and(server.embeddedContext(), client.embeddedContext()));
	}

	private static FileSystemCapabilities intersect(FileSystemCapabilities server, FileSystemCapabilities client) {
		if (server == null || client == null) {
			return server;
		}
		return new FileSystemCapabilities(and(server.readTextFile(), client.readTextFile()),
				and(server.writeTextFile(), client.writeTextFile()),
				and(server.listDirectory(), client.listDirectory()),
				and(server.createDirectory(), client.createDirectory()),
				and(server.deleteFile(), client.deleteFile()));
	}

	private static TerminalCapabilities intersect(TerminalCapabilities server, TerminalCapabilities client) {
		if (server == null || client == null) {
			return server;
		}
		return new TerminalCapabilities(and(server.create(), client.create()), and(server.resize(), client.resize()),
				and(server.sendInput(), client.sendInput()), and(server.readOutput(), client.readOutput()));
	}

	private static Boolean and(Boolean server, Boolean client) {
		boolean offered = Boolean.TRUE.equals(server);
		return client == null ? offered : offered && client;
	}

	public boolean supportsReadTextFile() {
		return capabilities.fs() != null && Boolean.TRUE.equals(capabilities.fs().readTextFile());
	}

	public boolean supportsWriteTextFile() {
		return capabilities.fs() != null && Boolean.TRUE.equals(capabilities.fs().writeTextFile());
	}

	public boolean supportsTerminal() {
		return capabilities.terminal() != null && Boolean.TRUE.equals(capabilities.terminal().create());
	}

	public boolean supportsImages() {
		return capabilities.prompt() != null && Boolean.TRUE.equals(capabilities.prompt().image());
	}

}
