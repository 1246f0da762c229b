/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.capabilities;

import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpSchema.AgentCapabilities;
import com.agentclientprotocol.gateway.spec.AcpSchema.FileSystemCapabilities;
import com.agentclientprotocol.gateway.spec.AcpSchema.InitializeRequest;
import com.agentclientprotocol.gateway.spec.AcpSchema.PromptCapabilities;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link NegotiatedCapabilities}.
 */
class NegotiatedCapabilitiesTest {

	private final AgentCapabilities server = new AgentCapabilities();

	@Test
	void missingRequestKeepsServerCapabilities() {
		NegotiatedCapabilities negotiated = NegotiatedCapabilities.negotiate(server, null);

		assertThat(negotiated.capabilities()).isEqualTo(server);
		assertThat(negotiated.protocolVersionMatched()).isTrue();
		assertThat(negotiated.supportsReadTextFile()).isTrue();
		assertThat(negotiated.supportsTerminal()).isTrue();
		assertThat(negotiated.supportsImages()).isFalse();
	}

	@Test
	void clientCanOnlyNarrowCapabilities() {
		AgentCapabilities client = new AgentCapabilities(new PromptCapabilities(true, false),
				new FileSystemCapabilities(true, false, true, null, null), null);

		NegotiatedCapabilities negotiated = NegotiatedCapabilities
			.negotiate(server, new InitializeRequest(AcpSchema.PROTOCOL_VERSION, client, null, null));

		AgentCapabilities effective = negotiated.capabilities();
		assertThat(effective.prompt().image()).isFalse();
		assertThat(effective.prompt().embeddedContext()).isFalse();
		assertThat(effective.fs().readTextFile()).isTrue();
		assertThat(effective.fs().writeTextFile()).isFalse();
		assertThat(effective.fs().listDirectory()).isFalse();
		assertThat(effective.fs().createDirectory()).isFalse();
		assertThat(effective.terminal()).isEqualTo(server.terminal());
		assertThat(negotiated.supportsWriteTextFile()).isFalse();
	}

	@Test
	void versionMismatchIsReportedButNotFatal() {
		NegotiatedCapabilities negotiated = NegotiatedCapabilities.negotiate(server,
				new InitializeRequest("0.1.0", null, null, null));

		assertThat(negotiated.protocolVersionMatched()).isFalse();
		assertThat(negotiated.capabilities()).isEqualTo(server);
	}

	@Test
	void negotiationIsRepeatable() {
		InitializeRequest request = new InitializeRequest(AcpSchema.PROTOCOL_VERSION,
				new AgentCapabilities(null, new FileSystemCapabilities(false, true, false, false, false), null), null,
				null);

		assertThat(NegotiatedCapabilities.negotiate(server, request))
			.isEqualTo(NegotiatedCapabilities.negotiate(server, request));
	}

}
