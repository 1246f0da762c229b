/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.server;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import com.agentclientprotocol.gateway.agent.AgentContext;
import com.agentclientprotocol.gateway.agent.AgentEvent;
import com.agentclientprotocol.gateway.agent.AgentRuntime;
import com.agentclientprotocol.gateway.agent.AgentTurn;
import com.agentclientprotocol.gateway.capabilities.NegotiatedCapabilities;
import com.agentclientprotocol.gateway.error.AcpErrorCodes;
import com.agentclientprotocol.gateway.error.AcpProtocolException;
import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession;
import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession.NotificationHandler;
import com.agentclientprotocol.gateway.jsonrpc.JsonRpcSession.RequestHandler;
import com.agentclientprotocol.gateway.session.GatewaySession;
import com.agentclientprotocol.gateway.session.SessionAdmissionException;
import com.agentclientprotocol.gateway.session.SessionChanges;
import com.agentclientprotocol.gateway.session.SessionManager;
import com.agentclientprotocol.gateway.spec.AcpMethod;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpSchema.AcpMessage;
import com.agentclientprotocol.gateway.spec.AcpSchema.PromptResult;
import com.agentclientprotocol.gateway.spec.AcpSchema.StopReason;
import com.agentclientprotocol.gateway.streaming.SessionUpdateNotifier;
import com.agentclientprotocol.gateway.tool.ToolRegistry;
import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Handlers for every {@link AcpMethod}. Each handler binds the wire params, calls the
 * session manager, agent runtime or tool registry, and maps the outcome back to a result
 * or an {@link AcpProtocolException}.
 *
 * <p>
 * The table is shared by all connections of a gateway. Sessions created on a connection
 * are remembered so they can be deleted when that connection goes away.
 * </p>
 *
 * @author Mark Pollack
 */
public class AcpMethodTable {

	private static final Logger logger = LoggerFactory.getLogger(AcpMethodTable.class);

	private final SessionManager sessions;

	private final AgentRuntime agentRuntime;

	private final ToolRegistry tools;

	private final McpJsonMapper jsonMapper;

	private final GatewaySettings settings;

	private final AtomicBoolean initialized = new AtomicBoolean(false);

	private final Map<String, RunningTurn> runningTurns = new ConcurrentHashMap<>();

	private final Map<String, Set<String>> sessionsByConnection = new ConcurrentHashMap<>();

	public AcpMethodTable(SessionManager sessions, AgentRuntime agentRuntime, ToolRegistry tools,
			McpJsonMapper jsonMapper, GatewaySettings settings) {
		Assert.notNull(sessions, "Session manager must not be null");
		Assert.notNull(agentRuntime, "Agent runtime must not be null");
		Assert.notNull(tools, "Tool registry must not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(settings, "Settings must not be null");
		this.sessions = sessions;
		this.agentRuntime = agentRuntime;
		this.tools = tools;
		this.jsonMapper = jsonMapper;
		this.settings = settings;
	}

	/**
	 * Builds the request handler table, one entry per {@link AcpMethod}.
	 * @return handlers keyed by wire method name
	 */
	public Map<String, RequestHandler<?>> requestHandlers() {
		Map<String, RequestHandler<?>> handlers = new LinkedHashMap<>();
		for (AcpMethod method : AcpMethod.values()) {
			RequestHandler<Object> handler = (session, params) -> dispatch(method, session, params);
			handlers.put(method.wireName(), handler);
		}
		return handlers;
	}

	/**
	 * Builds the notification handler table. {@code session/cancel} is accepted as a
	 * notification as well as a request.
	 * @return handlers keyed by wire method name
	 */
	public Map<String, NotificationHandler> notificationHandlers() {
		NotificationHandler cancel = (session, params) -> cancel(bind(params, AcpSchema.CancelRequest.class)).then();
		return Map.of(AcpSchema.METHOD_SESSION_CANCEL, cancel);
	}

	Mono<Object> dispatch(AcpMethod method, JsonRpcSession connection, Map<String, Object> params) {
		return Mono.defer(() -> invoke(method, connection, params).cast(Object.class));
	}

	private Mono<?> invoke(AcpMethod method, JsonRpcSession connection, Map<String, Object> params) {
		return switch (method) {
			case INITIALIZE -> initialize(bind(params, AcpSchema.InitializeRequest.class));
			case SESSION_NEW -> newSession(connection, bind(params, AcpSchema.NewSessionRequest.class));
			case SESSION_PROMPT -> prompt(connection, bind(params, AcpSchema.PromptRequest.class));
			case SESSION_SET_MODE -> setMode(bind(params, AcpSchema.SetSessionModeRequest.class));
			case SESSION_SET_MODEL -> setModel(bind(params, AcpSchema.SetSessionModelRequest.class));
			case SESSION_CANCEL -> cancel(bind(params, AcpSchema.CancelRequest.class));
			case TOOLS_LIST -> Mono.fromSupplier(() -> new AcpSchema.ListToolsResponse(tools.listTools()));
			case TOOLS_CALL -> callTool(bind(params, AcpSchema.CallToolRequest.class));
		};
	}

	private <T> T bind(Map<String, Object> params, Class<T> type) {
		try {
			return jsonMapper.convertValue(params, type);
		}
		catch (RuntimeException e) {
			throw AcpProtocolException.invalidParams("Invalid params: " + e.getMessage());
		}
	}

	private static String requireParam(String value, String name) {
		if (!Assert.hasText(value)) {
			throw AcpProtocolException.invalidParams("Missing required parameter '" + name + "'");
		}
		return value;
	}

	// ---------------------------
	// initialize
	// ---------------------------

	Mono<AcpSchema.InitializeResponse> initialize(AcpSchema.InitializeRequest request) {
		NegotiatedCapabilities negotiated = NegotiatedCapabilities.negotiate(settings.capabilities(), request);
		if (!negotiated.protocolVersionMatched()) {
			logger.warn("Client requested protocol version {}, gateway speaks {}", request.protocolVersion(),
					AcpSchema.PROTOCOL_VERSION);
		}
		Mono<Void> prime = Mono.defer(() -> {
			if (!initialized.compareAndSet(false, true)) {
				return Mono.empty();
			}
			logger.info("Initializing agent runtime");
			return agentRuntime.initialize().doOnError(error -> initialized.set(false));
		});
		return prime
			.onErrorMap(error -> !(error instanceof AcpProtocolException),
					error -> new AcpProtocolException(AcpErrorCodes.INTERNAL_ERROR,
							"Initialization failed: " + error.getMessage()))
			.then(Mono.fromSupplier(() -> new AcpSchema.InitializeResponse(AcpSchema.PROTOCOL_VERSION,
					negotiated.capabilities(), settings.serverInfo())));
	}

	public boolean isInitialized() {
		return initialized.get();
	}

	// ---------------------------
	// session/new
	// ---------------------------

	Mono<AcpSchema.NewSessionResponse> newSession(JsonRpcSession connection, AcpSchema.NewSessionRequest request) {
		String workingDirectory = resolveWorkingDirectory(request.workingDirectory());
		return Mono.fromCallable(() -> sessions.create(workingDirectory, request.metadata(), request.mode(),
				request.model()))
			.flatMap(session -> agentRuntime
				.createContext(new AgentContext(session.sessionId(), workingDirectory, session.metadata()))
				.thenReturn(session)
				.onErrorResume(error -> {
					sessions.delete(session.sessionId());
					return Mono.error(error);
				}))
			.doOnNext(session -> sessionsByConnection
				.computeIfAbsent(connection.getId(), id -> ConcurrentHashMap.newKeySet())
				.add(session.sessionId()))
			.map(session -> new AcpSchema.NewSessionResponse(session.sessionId(), settings.capabilities(),
					settings.availableModels(), settings.availableModes()))
			.onErrorMap(error -> !(error instanceof AcpProtocolException), error -> {
				Object data = error instanceof SessionAdmissionException admission
						? Map.of("reason", admission.getReason().name().toLowerCase()) : null;
				return new AcpProtocolException(AcpErrorCodes.INTERNAL_ERROR,
						"Session creation failed: " + error.getMessage(), data);
			});
	}

	private String resolveWorkingDirectory(String requested) {
		String directory = Assert.hasText(requested) ? requested : settings.defaultWorkingDirectory();
		return Path.of(directory).toAbsolutePath().normalize().toString();
	}

	// ---------------------------
	// session/prompt
	// ---------------------------

	Mono<PromptResult> prompt(JsonRpcSession connection, AcpSchema.PromptRequest request) {
		String sessionId = requireParam(request.sessionId(), "session_id");
		if (request.message() == null) {
			throw AcpProtocolException.invalidParams("Missing required parameter 'message'");
		}
		sessions.require(sessionId);
		GatewaySession session = sessions
			.update(sessionId,
					SessionChanges.messageProcessed().withMode(request.mode()).withModel(request.model()))
			.orElseThrow(() -> AcpProtocolException.sessionNotFound(sessionId));

		AgentTurn turn = new AgentTurn(sessionId, request.message(), session.mode(), session.model(),
				session.workingDirectory(), request.metadata());
		SessionUpdateNotifier notifier = new SessionUpdateNotifier(connection, sessionId);
		RunningTurn running = new RunningTurn();
		RunningTurn previous = runningTurns.put(sessionId, running);
		if (previous != null) {
			previous.cancel();
		}
		TurnState state = new TurnState();

		logger.info("Processing prompt for session {}", sessionId);
		return Flux.defer(() -> agentRuntime.runTurn(turn))
			.takeUntilOther(running.signal.asMono())
			.takeWhile(event -> admit(event, state))
			.takeUntil(event -> event instanceof AgentEvent.TurnCompleted)
			.concatMap(event -> publish(event, sessionId, notifier, state))
			.then(Mono.defer(() -> finish(running, state, notifier)))
			.onErrorResume(error -> {
				String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
				logger.error("Prompt processing failed for session {}", sessionId, error);
				AcpProtocolException failure = error instanceof AcpProtocolException protocolError ? protocolError
						: new AcpProtocolException(AcpErrorCodes.AGENT_ERROR, "Prompt processing failed: " + message);
				return notifier.error(message).then(Mono.error(failure));
			})
			.doFinally(signal -> runningTurns.remove(sessionId, running));
	}

	private boolean admit(AgentEvent event, TurnState state) {
		if (event instanceof AgentEvent.ToolCallStarted && ++state.toolCalls > settings.maxToolCallsPerTurn()) {
			state.limitReached = true;
			return false;
		}
		return true;
	}

	private Mono<Void> publish(AgentEvent event, String sessionId, SessionUpdateNotifier notifier, TurnState state) {
		if (event instanceof AgentEvent.MessageChunk chunk) {
			state.lastMessage = chunk.message();
			return notifier.message(chunk.message());
		}
		if (event instanceof AgentEvent.ToolCallStarted call) {
			sessions.update(sessionId, SessionChanges.toolCalled());
			return notifier.toolCall(call.toolCallId(), call.name(), call.arguments());
		}
		if (event instanceof AgentEvent.ToolCallFinished finished) {
			return notifier.toolResult(finished.toolCallId(), finished.name(), finished.result());
		}
		if (event instanceof AgentEvent.ErrorReported reported) {
			state.lastError = reported.message();
			return notifier.error(reported.message());
		}
		state.result = ((AgentEvent.TurnCompleted) event).result();
		return Mono.empty();
	}

	private Mono<PromptResult> finish(RunningTurn running, TurnState state, SessionUpdateNotifier notifier) {
		if (running.cancelled) {
			PromptResult result = new PromptResult(orDefault(state.lastMessage, "Cancelled"), StopReason.USER_STOP);
			return notifier.cancelled().thenReturn(result);
		}
		PromptResult result;
		if (state.limitReached) {
			result = new PromptResult(orDefault(state.lastMessage, "Tool call limit reached"),
					StopReason.TOOL_CALL_LIMIT);
		}
		else if (state.result != null) {
			result = state.result;
		}
		else if (state.lastError != null) {
			result = new PromptResult(AcpMessage.assistant("Error: " + state.lastError), StopReason.ERROR);
		}
		else {
			result = new PromptResult(orDefault(state.lastMessage, "No response generated"), StopReason.COMPLETION);
		}
		return notifier.complete(result).thenReturn(result);
	}

	private static AcpMessage orDefault(AcpMessage message, String fallback) {
		return message != null ? message : AcpMessage.assistant(fallback);
	}

	// ---------------------------
	// session/set_mode, session/set_model, session/cancel
	// ---------------------------

	Mono<AcpSchema.SetSessionModeResponse> setMode(AcpSchema.SetSessionModeRequest request) {
		String sessionId = requireParam(request.sessionId(), "session_id");
		String mode = requireParam(request.mode(), "mode");
		sessions.require(sessionId);
		sessions.update(sessionId, SessionChanges.mode(mode));
		logger.info("Session {} mode set to {}", sessionId, mode);
		return Mono.just(new AcpSchema.SetSessionModeResponse(true, mode));
	}

	Mono<AcpSchema.SetSessionModelResponse> setModel(AcpSchema.SetSessionModelRequest request) {
		String sessionId = requireParam(request.sessionId(), "session_id");
		String model = requireParam(request.model(), "model");
		sessions.require(sessionId);
		sessions.update(sessionId, SessionChanges.model(model));
		logger.info("Session {} model set to {}", sessionId, model);
		return Mono.just(new AcpSchema.SetSessionModelResponse(true, model));
	}

	Mono<AcpSchema.CancelResponse> cancel(AcpSchema.CancelRequest request) {
		String sessionId = requireParam(request.sessionId(), "session_id");
		sessions.require(sessionId);
		sessions.update(sessionId, SessionChanges.deactivate());
		RunningTurn running = runningTurns.get(sessionId);
		if (running != null) {
			running.cancel();
		}
		logger.info("Cancelled session {}", sessionId);
		Mono<Void> release = Boolean.TRUE.equals(request.delete()) ? deleteSession(sessionId) : Mono.empty();
		return agentRuntime.cancel(sessionId)
			.onErrorResume(error -> {
				logger.warn("Agent runtime failed to cancel session {}", sessionId, error);
				return Mono.empty();
			})
			.then(release)
			.thenReturn(new AcpSchema.CancelResponse(true));
	}

	// ---------------------------
	// tools/call
	// ---------------------------

	Mono<AcpSchema.ToolResult> callTool(AcpSchema.CallToolRequest request) {
		String name = requireParam(request.name(), "name");
		String workingDirectory = null;
		if (request.sessionId() != null) {
			workingDirectory = sessions.get(request.sessionId()).map(GatewaySession::workingDirectory).orElse(null);
			if (workingDirectory == null) {
				logger.debug("tools/call names unknown session {}, running without session context",
						request.sessionId());
			}
		}
		boolean scoped = workingDirectory != null;
		return tools.callTool(name, request.arguments(), workingDirectory).doOnNext(result -> {
			if (scoped) {
				sessions.update(request.sessionId(), SessionChanges.toolCalled());
			}
		});
	}

	// ---------------------------
	// Lifecycle
	// ---------------------------

	/**
	 * Deletes every session created on a connection that has gone away.
	 * @param connectionId the connection's session id
	 * @return a Mono completing when the sessions are released
	 */
	public Mono<Void> releaseConnection(String connectionId) {
		Set<String> owned = sessionsByConnection.remove(connectionId);
		if (owned == null || owned.isEmpty()) {
			return Mono.empty();
		}
		logger.info("Connection {} closed, releasing {} session(s)", connectionId, owned.size());
		return Flux.fromIterable(owned).concatMap(sessionId -> {
			RunningTurn running = runningTurns.get(sessionId);
			if (running != null) {
				running.cancel();
			}
			return deleteSession(sessionId);
		}).then();
	}

	/**
	 * Releases the agent context of a session removed by the expiry sweep.
	 * @param session the expired session
	 */
	public void onSessionExpired(GatewaySession session) {
		agentRuntime.releaseContext(session.sessionId())
			.subscribe(null, error -> logger.warn("Failed to release context of expired session {}",
					session.sessionId(), error));
	}

	private Mono<Void> deleteSession(String sessionId) {
		if (!sessions.delete(sessionId)) {
			return Mono.empty();
		}
		return agentRuntime.releaseContext(sessionId).onErrorResume(error -> {
			logger.warn("Failed to release context of session {}", sessionId, error);
			return Mono.empty();
		});
	}

	private static final class RunningTurn {

		private final Sinks.One<Boolean> signal = Sinks.one();

		private volatile boolean cancelled;

		void cancel() {
			cancelled = true;
			signal.tryEmitValue(Boolean.TRUE);
		}

	}

	private static final class TurnState {

		private AcpMessage lastMessage;

		private String lastError;

		private PromptResult result;

		private int toolCalls;

		private boolean limitReached;

	}

}
