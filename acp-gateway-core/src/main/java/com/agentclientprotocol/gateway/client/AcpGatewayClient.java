/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.client;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpTransport;
import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Asynchronous client for an ACP gateway. Every operation is one request whose result is
 * bound to its schema type; {@code session/update} notifications received while a prompt
 * runs are passed to the registered consumers.
 *
 * <pre>{@code
 * AcpGatewayClient client = AcpGatewayClient.builder(transport)
 *     .sessionUpdateConsumer(update -> System.err.println(update.type()))
 *     .build();
 * client.initialize(new AcpSchema.InitializeRequest()).block();
 * String sessionId = client.newSession(new AcpSchema.NewSessionRequest("/tmp")).block().sessionId();
 * }</pre>
 *
 * @author Mark Pollack
 */
public class AcpGatewayClient {

	private static final Logger logger = LoggerFactory.getLogger(AcpGatewayClient.class);

	private static final TypeRef<AcpSchema.InitializeResponse> INITIALIZE_RESPONSE = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.NewSessionResponse> NEW_SESSION_RESPONSE = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.PromptResult> PROMPT_RESULT = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.SetSessionModeResponse> SET_MODE_RESPONSE = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.SetSessionModelResponse> SET_MODEL_RESPONSE = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.CancelResponse> CANCEL_RESPONSE = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.ListToolsResponse> LIST_TOOLS_RESPONSE = new TypeRef<>() {
	};

	private static final TypeRef<AcpSchema.ToolResult> TOOL_RESULT = new TypeRef<>() {
	};

	private final JsonRpcSession session;

	private final McpJsonMapper jsonMapper;

	private final List<Consumer<AcpSchema.SessionUpdate>> sessionUpdateConsumers;

	private AcpGatewayClient(Builder builder) {
		this.jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonMapper.getDefault();
		this.sessionUpdateConsumers = List.copyOf(builder.sessionUpdateConsumers);
		this.session = new JsonRpcSession("client", builder.requestTimeout, builder.transport, jsonMapper, Map.of(),
				Map.of(), this::onNotification);
	}

	public static Builder builder(AcpTransport transport) {
		return new Builder(transport);
	}

	private void onNotification(AcpSchema.JSONRPCNotification notification) {
		if (!AcpSchema.METHOD_SESSION_UPDATE.equals(notification.method())) {
			logger.debug("Ignoring notification '{}'", notification.method());
			return;
		}
		AcpSchema.SessionUpdate update = jsonMapper.convertValue(notification.params(), AcpSchema.SessionUpdate.class);
		for (Consumer<AcpSchema.SessionUpdate> consumer : sessionUpdateConsumers) {
			consumer.accept(update);
		}
	}

	public Mono<AcpSchema.InitializeResponse> initialize(AcpSchema.InitializeRequest request) {
		return session.sendRequest(AcpSchema.METHOD_INITIALIZE, request, INITIALIZE_RESPONSE);
	}

	public Mono<AcpSchema.NewSessionResponse> newSession(AcpSchema.NewSessionRequest request) {
		return session.sendRequest(AcpSchema.METHOD_SESSION_NEW, request, NEW_SESSION_RESPONSE);
	}

	/**
	 * Sends a prompt. Updates for the turn reach the session update consumers before the
	 * returned Mono emits.
	 * @param request the prompt
	 * @return the final result of the turn
	 */
	public Mono<AcpSchema.PromptResult> prompt(AcpSchema.PromptRequest request) {
		return session.sendRequest(AcpSchema.METHOD_SESSION_PROMPT, request, PROMPT_RESULT);
	}

	public Mono<AcpSchema.SetSessionModeResponse> setMode(AcpSchema.SetSessionModeRequest request) {
		return session.sendRequest(AcpSchema.METHOD_SESSION_SET_MODE, request, SET_MODE_RESPONSE);
	}

	public Mono<AcpSchema.SetSessionModelResponse> setModel(AcpSchema.SetSessionModelRequest request) {
		return session.sendRequest(AcpSchema.METHOD_SESSION_SET_MODEL, request, SET_MODEL_RESPONSE);
	}

	public Mono<AcpSchema.CancelResponse> cancel(AcpSchema.CancelRequest request) {
		return session.sendRequest(AcpSchema.METHOD_SESSION_CANCEL, request, CANCEL_RESPONSE);
	}

	public Mono<AcpSchema.ListToolsResponse> listTools() {
		return session.sendRequest(AcpSchema.METHOD_TOOLS_LIST, Map.of(), LIST_TOOLS_RESPONSE);
	}

	public Mono<AcpSchema.ToolResult> callTool(AcpSchema.CallToolRequest request) {
		return session.sendRequest(AcpSchema.METHOD_TOOLS_CALL, request, TOOL_RESULT);
	}

	public Mono<Void> closeGracefully() {
		return session.closeGracefully();
	}

	public void close() {
		session.close();
	}

	/**
	 * Builder for {@link AcpGatewayClient}.
	 */
	public static class Builder {

		private final AcpTransport transport;

		private Duration requestTimeout = Duration.ofSeconds(30);

		private McpJsonMapper jsonMapper;

		private final List<Consumer<AcpSchema.SessionUpdate>> sessionUpdateConsumers = new ArrayList<>();

		private Builder(AcpTransport transport) {
			Assert.notNull(transport, "Transport must not be null");
			this.transport = transport;
		}

		/**
		 * Sets how long to wait for each response. A prompt counts as one request, so the
		 * timeout must cover a whole turn.
		 * @param requestTimeout the timeout
		 * @return this builder
		 */
		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "The JsonMapper can not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public Builder sessionUpdateConsumer(Consumer<AcpSchema.SessionUpdate> consumer) {
			Assert.notNull(consumer, "Session update consumer must not be null");
			this.sessionUpdateConsumers.add(consumer);
			return this;
		}

		public AcpGatewayClient build() {
			return new AcpGatewayClient(this);
		}

	}

}
