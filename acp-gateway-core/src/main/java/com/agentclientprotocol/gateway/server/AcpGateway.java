/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.server;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import com.agentclientprotocol.gateway.agent.AgentRuntime;
import com.agentclientprotocol.gateway.agent.UnconfiguredAgentRuntime;
import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession;
import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession.NotificationHandler;
import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession.RequestHandler;
import com.agentclientprotocol.gateway.session.SessionManager;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpTransport;
import com.agentclientprotocol.gateway.tool.AcpTool;
import com.agentclientprotocol.gateway.tool.ToolRegistry;
import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * The ACP gateway: one method table, one session manager and one tool registry shared by
 * every connection served through {@link #serve(AcpTransport)}.
 *
 * <p>
 * Example:
 *
 * <pre>{@code
 * AcpGateway gateway = AcpGateway.builder()
 *     .agentRuntime(myRuntime)
 *     .tool(new BashTool())
 *     .build();
 * gateway.start();
 * gateway.serve(new StdioAcpTransport(McpJsonMapper.getDefault())).block();
 * }</pre>
 *
 * @author Mark Pollack
 */
public class AcpGateway {

	private static final Logger logger = LoggerFactory.getLogger(AcpGateway.class);

	public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);

	public static final AcpSchema.ServerInfo DEFAULT_SERVER_INFO = new AcpSchema.ServerInfo("web-agent-ACP", "0.1.0");

	private final SessionManager sessionManager;

	private final AgentRuntime agentRuntime;

	private final ToolRegistry toolRegistry;

	private final McpJsonMapper jsonMapper;

	private final Duration requestTimeout;

	private final GatewaySettings settings;

	private final AcpMethodTable methodTable;

	private final Map<String, RequestHandler<?>> requestHandlers;

	private final Map<String, NotificationHandler> notificationHandlers;

	private final Set<JsonRpcSession> connections = ConcurrentHashMap.newKeySet();

	private final AtomicLong connectionCounter = new AtomicLong(0);

	private AcpGateway(Builder builder) {
		this.jsonMapper = builder.jsonMapper != null ? builder.jsonMapper : McpJsonMapper.getDefault();
		this.agentRuntime = builder.agentRuntime != null ? builder.agentRuntime : new UnconfiguredAgentRuntime();
		this.requestTimeout = builder.requestTimeout;
		this.toolRegistry = new ToolRegistry(jsonMapper, builder.tools).errorHeuristic(builder.toolErrorHeuristic);
		this.settings = new GatewaySettings(builder.serverInfo, builder.capabilities, List.copyOf(builder.availableModels),
				List.copyOf(builder.availableModes), builder.maxToolCallsPerTurn, builder.defaultWorkingDirectory);

		AtomicReference<AcpMethodTable> tableRef = new AtomicReference<>();
		this.sessionManager = builder.sessionManager != null ? builder.sessionManager
				: SessionManager.builder()
					.maxSessions(builder.maxSessions)
					.sessionTimeout(builder.sessionTimeout)
					.sweepInterval(builder.sweepInterval)
					.expirationListener(session -> tableRef.get().onSessionExpired(session))
					.build();
		this.methodTable = new AcpMethodTable(sessionManager, agentRuntime, toolRegistry, jsonMapper, settings);
		tableRef.set(methodTable);
		this.requestHandlers = methodTable.requestHandlers();
		this.notificationHandlers = methodTable.notificationHandlers();
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Starts background housekeeping such as the session expiry sweep.
	 */
	public void start() {
		sessionManager.start();
		logger.info("{} {} ready with {} tool(s)", settings.serverInfo().name(), settings.serverInfo().version(),
				toolRegistry.getToolNames().size());
	}

	/**
	 * Serves one connection until its transport terminates, then deletes the sessions it
	 * created.
	 * @param transport the connection's transport, not yet started
	 * @return a Mono completing once the connection is gone and its sessions released
	 */
	public Mono<Void> serve(AcpTransport transport) {
		Assert.notNull(transport, "Transport must not be null");
		return Mono.defer(() -> {
			String connectionId = "connection-" + connectionCounter.incrementAndGet();
			JsonRpcSession connection = new JsonRpcSession(connectionId, requestTimeout, transport, jsonMapper,
					requestHandlers, notificationHandlers);
			connections.add(connection);
			logger.info("Accepted {}", connectionId);
			return connection.awaitTermination()
				.then(Mono.defer(() -> methodTable.releaseConnection(connectionId)))
				.doFinally(signal -> {
					connections.remove(connection);
					logger.info("Closed {}", connectionId);
				});
		});
	}

	/**
	 * Closes every open connection, stops the session sweep and releases tool workers.
	 * @return a Mono completing when shut down
	 */
	public Mono<Void> closeGracefully() {
		return Flux.fromIterable(new ArrayList<>(connections))
			.flatMap(connection -> connection.closeGracefully().onErrorResume(error -> {
				logger.warn("Failed to close {}", connection.getId(), error);
				return Mono.empty();
			}))
			.then(Mono.fromRunnable(() -> {
				sessionManager.stop();
				toolRegistry.close();
				logger.info("Gateway stopped");
			}));
	}

	public boolean isInitialized() {
		return methodTable.isInitialized();
	}

	public SessionManager getSessionManager() {
		return sessionManager;
	}

	public ToolRegistry getToolRegistry() {
		return toolRegistry;
	}

	public AcpSchema.ServerInfo getServerInfo() {
		return settings.serverInfo();
	}

	public McpJsonMapper getJsonMapper() {
		return jsonMapper;
	}

	/**
	 * Builder for {@link AcpGateway}.
	 */
	public static class Builder {

		private SessionManager sessionManager;

		private int maxSessions = SessionManager.DEFAULT_MAX_SESSIONS;

		private Duration sessionTimeout = SessionManager.DEFAULT_SESSION_TIMEOUT;

		private Duration sweepInterval = SessionManager.DEFAULT_SWEEP_INTERVAL;

		private AgentRuntime agentRuntime;

		private final List<AcpTool> tools = new ArrayList<>();

		private boolean toolErrorHeuristic = true;

		private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;

		private AcpSchema.ServerInfo serverInfo = DEFAULT_SERVER_INFO;

		private AcpSchema.AgentCapabilities capabilities = new AcpSchema.AgentCapabilities();

		private List<String> availableModels = GatewaySettings.DEFAULT_MODELS;

		private List<String> availableModes = GatewaySettings.DEFAULT_MODES;

		private int maxToolCallsPerTurn = GatewaySettings.DEFAULT_MAX_TOOL_CALLS_PER_TURN;

		private String defaultWorkingDirectory = ".";

		private McpJsonMapper jsonMapper;

		private Builder() {
		}

		/**
		 * Uses a preconfigured session manager. The builder's session limits are ignored and
		 * expired sessions do not release their agent context.
		 * @param sessionManager the session manager
		 * @return this builder
		 */
		public Builder sessionManager(SessionManager sessionManager) {
			Assert.notNull(sessionManager, "Session manager must not be null");
			this.sessionManager = sessionManager;
			return this;
		}

		public Builder maxSessions(int maxSessions) {
			Assert.isTrue(maxSessions > 0, "Max sessions must be positive");
			this.maxSessions = maxSessions;
			return this;
		}

		public Builder sessionTimeout(Duration sessionTimeout) {
			Assert.notNull(sessionTimeout, "Session timeout must not be null");
			this.sessionTimeout = sessionTimeout;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			Assert.notNull(sweepInterval, "Sweep interval must not be null");
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder agentRuntime(AgentRuntime agentRuntime) {
			Assert.notNull(agentRuntime, "Agent runtime must not be null");
			this.agentRuntime = agentRuntime;
			return this;
		}

		public Builder tool(AcpTool tool) {
			Assert.notNull(tool, "Tool must not be null");
			this.tools.add(tool);
			return this;
		}

		public Builder tools(Collection<? extends AcpTool> tools) {
			Assert.notNull(tools, "Tools must not be null");
			tools.forEach(this::tool);
			return this;
		}

		/**
		 * Whether plain-text tool output that looks like an error is reported with
		 * {@code is_error} set. Enabled by default.
		 * @param enabled true to enable the heuristic
		 * @return this builder
		 */
		public Builder toolErrorHeuristic(boolean enabled) {
			this.toolErrorHeuristic = enabled;
			return this;
		}

		public Builder requestTimeout(Duration requestTimeout) {
			Assert.notNull(requestTimeout, "Request timeout must not be null");
			this.requestTimeout = requestTimeout;
			return this;
		}

		public Builder serverInfo(AcpSchema.ServerInfo serverInfo) {
			Assert.notNull(serverInfo, "Server info must not be null");
			this.serverInfo = serverInfo;
			return this;
		}

		public Builder capabilities(AcpSchema.AgentCapabilities capabilities) {
			Assert.notNull(capabilities, "Capabilities must not be null");
			this.capabilities = capabilities;
			return this;
		}

		public Builder availableModels(List<String> availableModels) {
			Assert.notNull(availableModels, "Models must not be null");
			this.availableModels = availableModels;
			return this;
		}

		public Builder availableModes(List<String> availableModes) {
			Assert.notNull(availableModes, "Modes must not be null");
			this.availableModes = availableModes;
			return this;
		}

		public Builder maxToolCallsPerTurn(int maxToolCallsPerTurn) {
			Assert.isTrue(maxToolCallsPerTurn > 0, "Tool call limit must be positive");
			this.maxToolCallsPerTurn = maxToolCallsPerTurn;
			return this;
		}

		public Builder defaultWorkingDirectory(String defaultWorkingDirectory) {
			Assert.hasText(defaultWorkingDirectory, "Working directory must not be empty");
			this.defaultWorkingDirectory = defaultWorkingDirectory;
			return this;
		}

		public Builder jsonMapper(McpJsonMapper jsonMapper) {
			Assert.notNull(jsonMapper, "The JsonMapper can not be null");
			this.jsonMapper = jsonMapper;
			return this;
		}

		public AcpGateway build() {
			return new AcpGateway(this);
		}

	}

}
