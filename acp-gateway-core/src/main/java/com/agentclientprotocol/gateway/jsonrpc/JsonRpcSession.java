/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.jsonrpc;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

import com.agentclientprotocol.gateway.codec.NdjsonFrameEncoder;
import com.agentclientprotocol.gateway.error.AcpErrorCodes;
import com.agentclientprotocol.gateway.error.AcpException;
import com.agentclientprotocol.gateway.error.AcpProtocolException;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpSchema.JSONRPCMessage;
import com.agentclientprotocol.gateway.spec.AcpSchema.JSONRPCNotification;
import com.agentclientprotocol.gateway.spec.AcpSchema.JSONRPCRequest;
import com.agentclientprotocol.gateway.spec.AcpSchema.JSONRPCResponse;
import com.agentclientprotocol.gateway.spec.AcpTransport;
import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.MonoSink;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * One JSON-RPC 2.0 peer bound to one transport connection.
 *
 * <p>
 * Inbound, every frame goes through {@link #process(String)}: it is decoded, checked
 * against the envelope rules and either dispatched to a request handler (producing exactly
 * one response), dispatched to a notification handler (producing nothing), or matched
 * against an outstanding outbound request. Failures never escape the frame boundary; they
 * become error responses or log entries.
 * </p>
 *
 * <p>
 * Outbound, {@link #sendRequest(String, Object, TypeRef)} assigns increasing integer ids
 * and correlates responses, failing with {@link java.util.concurrent.TimeoutException}
 * when no response arrives within the request timeout.
 * </p>
 *
 * @author Mark Pollack
 * @author Christian Tzolov
 */
public class JsonRpcSession {

	private static final Logger logger = LoggerFactory.getLogger(JsonRpcSession.class);

	private static final Scheduler TIMEOUT_SCHEDULER = Schedulers.fromExecutorService(Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "acp-request-timeout");
			t.setDaemon(true);
			return t;
		}), "request-timeout");

	private static final TypeRef<Object> VALUE_TYPE_REF = new TypeRef<>() {
	};

	private final String id;

	private final Duration requestTimeout;

	private final AcpTransport transport;

	private final McpJsonMapper jsonMapper;

	private final NdjsonFrameEncoder encoder;

	private final Map<String, RequestHandler<?>> requestHandlers;

	private final Map<String, NotificationHandler> notificationHandlers;

	private final Consumer<JSONRPCNotification> notificationObserver;

	private final ConcurrentHashMap<Object, MonoSink<JSONRPCResponse>> pendingResponses = new ConcurrentHashMap<>();

	private final AtomicLong requestCounter = new AtomicLong(0);

	/**
	 * Handles an inbound request and produces its result.
	 *
	 * @param <T> the result type
	 */
	@FunctionalInterface
	public interface RequestHandler<T> {

		/**
		 * @param session the session the request arrived on
		 * @param params the request params, empty when absent
		 * @return a Mono emitting the result; an empty Mono yields an empty object
		 */
		Mono<T> handle(JsonRpcSession session, Map<String, Object> params);

	}

	/**
	 * Handles an inbound notification.
	 */
	@FunctionalInterface
	public interface NotificationHandler {

		Mono<Void> handle(JsonRpcSession session, Map<String, Object> params);

	}

	public JsonRpcSession(String id, Duration requestTimeout, AcpTransport transport, McpJsonMapper jsonMapper,
			Map<String, RequestHandler<?>> requestHandlers, Map<String, NotificationHandler> notificationHandlers) {
		this(id, requestTimeout, transport, jsonMapper, requestHandlers, notificationHandlers, null);
	}

	/**
	 * Creates a session and starts the transport.
	 * @param id identifier of this connection, used in logs
	 * @param requestTimeout deadline for outbound requests
	 * @param transport the transport to read from and write to
	 * @param jsonMapper mapper for decoding frames and binding results
	 * @param requestHandlers request handlers keyed by method name
	 * @param notificationHandlers notification handlers keyed by method name
	 * @param notificationObserver receives notifications that have no handler, may be
	 * null
	 */
	public JsonRpcSession(String id, Duration requestTimeout, AcpTransport transport, McpJsonMapper jsonMapper,
			Map<String, RequestHandler<?>> requestHandlers, Map<String, NotificationHandler> notificationHandlers,
			Consumer<JSONRPCNotification> notificationObserver) {
		Assert.hasText(id, "Session id must not be empty");
		Assert.notNull(requestTimeout, "Request timeout must not be null");
		Assert.notNull(transport, "Transport must not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(requestHandlers, "Request handlers must not be null");
		Assert.notNull(notificationHandlers, "Notification handlers must not be null");

		this.id = id;
		this.requestTimeout = requestTimeout;
		this.transport = transport;
		this.jsonMapper = jsonMapper;
		this.encoder = new NdjsonFrameEncoder(jsonMapper);
		this.requestHandlers = Map.copyOf(requestHandlers);
		this.notificationHandlers = Map.copyOf(notificationHandlers);
		this.notificationObserver = notificationObserver;

		this.transport.start(this::handleFrame)
			.subscribe(null, error -> logger.error("Session {} failed to start its transport", id, error));
	}

	public String getId() {
		return id;
	}

	private Mono<Void> handleFrame(String frame) {
		return process(frame).flatMap(transport::sendFrame)
			.onErrorResume(error -> {
				logger.error("Session {} failed to handle frame", id, error);
				return Mono.empty();
			});
	}

	/**
	 * Processes one raw inbound frame.
	 * @param rawFrame a single line of JSON text
	 * @return a Mono emitting the encoded response frame, or empty when none is due
	 */
	public Mono<String> process(String rawFrame) {
		return Mono.defer(() -> {
			logger.debug("Session {} received: {}", id, rawFrame);
			Object value;
			try {
				value = jsonMapper.readValue(rawFrame, VALUE_TYPE_REF);
			}
			catch (IOException | RuntimeException e) {
				logger.warn("Session {} received a frame that is not valid JSON: {}", id, e.getMessage());
				return Mono.just(encoder.encode(JSONRPCResponse.failure(null,
						new AcpSchema.JSONRPCError(AcpErrorCodes.PARSE_ERROR, "Parse error: " + e.getMessage(), null))));
			}

			JSONRPCMessage message;
			try {
				message = JsonRpcEnvelopes.classify(jsonMapper, value);
			}
			catch (InvalidEnvelopeException e) {
				if (e.getKind() == InvalidEnvelopeException.Kind.REQUEST) {
					logger.warn("Session {} rejected request: {}", id, e.getErrorMessage());
					return Mono.just(encoder.encode(JSONRPCResponse.failure(e.getRequestId(), e.toJsonRpcError())));
				}
				logger.warn("Session {} dropped invalid {}: {}", id, e.getKind().name().toLowerCase(),
						e.getErrorMessage());
				return Mono.empty();
			}

			if (message instanceof JSONRPCRequest request) {
				return handleIncomingRequest(request).map(encoder::encode);
			}
			if (message instanceof JSONRPCNotification notification) {
				return handleIncomingNotification(notification).then(Mono.empty());
			}
			handleIncomingResponse((JSONRPCResponse) message);
			return Mono.empty();
		});
	}

	private Mono<JSONRPCResponse> handleIncomingRequest(JSONRPCRequest request) {
		RequestHandler<?> handler = requestHandlers.get(request.method());
		if (handler == null) {
			logger.warn("Session {} has no handler for method '{}'", id, request.method());
			return Mono.just(JSONRPCResponse.failure(request.id(), new AcpSchema.JSONRPCError(
					AcpErrorCodes.METHOD_NOT_FOUND, "Method '" + request.method() + "' not found", null)));
		}
		return Mono.defer(() -> handler.handle(this, paramsOf(request.params())))
			.map(result -> JSONRPCResponse.success(request.id(), result))
			.switchIfEmpty(Mono.fromSupplier(() -> JSONRPCResponse.success(request.id(), Map.of())))
			.onErrorResume(error -> Mono.just(errorResponse(request, error)));
	}

	private JSONRPCResponse errorResponse(JSONRPCRequest request, Throwable error) {
		if (error instanceof AcpProtocolException protocolError) {
			logger.debug("Session {} request '{}' failed: {}", id, request.method(), protocolError.getMessage());
			return JSONRPCResponse.failure(request.id(), protocolError.toJsonRpcError());
		}
		logger.error("Session {} request '{}' failed unexpectedly", id, request.method(), error);
		String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
		return JSONRPCResponse.failure(request.id(),
				new AcpSchema.JSONRPCError(AcpErrorCodes.INTERNAL_ERROR, message, null));
	}

	private Mono<Void> handleIncomingNotification(JSONRPCNotification notification) {
		NotificationHandler handler = notificationHandlers.get(notification.method());
		if (handler == null) {
			if (notificationObserver != null) {
				return Mono.fromRunnable(() -> notificationObserver.accept(notification))
					.onErrorResume(error -> {
						logger.error("Session {} notification observer failed", id, error);
						return Mono.empty();
					})
					.then();
			}
			logger.debug("Session {} dropped notification '{}' with no handler", id, notification.method());
			return Mono.empty();
		}
		return Mono.defer(() -> handler.handle(this, paramsOf(notification.params())))
			.onErrorResume(error -> {
				logger.error("Session {} notification '{}' failed", id, notification.method(), error);
				return Mono.empty();
			});
	}

	private void handleIncomingResponse(JSONRPCResponse response) {
		MonoSink<JSONRPCResponse> sink = pendingResponses.remove(response.id());
		if (sink == null) {
			logger.warn("Session {} dropped response for unknown id {}", id, response.id());
			return;
		}
		sink.success(response);
	}

	@SuppressWarnings("unchecked")
	private static Map<String, Object> paramsOf(Object params) {
		return params instanceof Map ? (Map<String, Object>) params : Map.of();
	}

	/**
	 * Sends a request and waits for the correlated response.
	 * @param <T> the result type
	 * @param method the method name
	 * @param params the request params, may be null
	 * @param typeRef target type of the result
	 * @return a Mono emitting the result, failing with {@link AcpProtocolException} on an
	 * error response or {@link java.util.concurrent.TimeoutException} on expiry
	 */
	public <T> Mono<T> sendRequest(String method, Object params, TypeRef<T> typeRef) {
		return Mono.defer(() -> {
			Long requestId = requestCounter.incrementAndGet();
			return Mono.<JSONRPCResponse>create(sink -> {
				if (pendingResponses.putIfAbsent(requestId, sink) != null) {
					sink.error(new AcpException("Request id " + requestId + " is already pending"));
					return;
				}
				JSONRPCRequest request = new JSONRPCRequest(method, requestId, params);
				transport.sendFrame(encoder.encode(request)).subscribe(null, error -> {
					pendingResponses.remove(requestId);
					sink.error(error);
				});
			})
				.timeout(requestTimeout, TIMEOUT_SCHEDULER)
				.doFinally(signal -> pendingResponses.remove(requestId))
				.<T>handle((response, sink) -> {
					if (response.error() != null) {
						sink.error(new AcpProtocolException(response.error()));
					}
					else if (response.result() != null) {
						sink.next(jsonMapper.convertValue(response.result(), typeRef));
					}
					else {
						sink.complete();
					}
				});
		});
	}

	/**
	 * Sends a notification.
	 * @param method the method name
	 * @param params the params, may be null
	 * @return a Mono that completes once the frame is queued
	 */
	public Mono<Void> sendNotification(String method, Object params) {
		return Mono.defer(() -> transport.sendFrame(encoder.encode(new JSONRPCNotification(method, params))));
	}

	/**
	 * Returns the number of outbound requests awaiting a response.
	 * @return the pending count
	 */
	public int getPendingRequestCount() {
		return pendingResponses.size();
	}

	public Mono<Void> awaitTermination() {
		return transport.awaitTermination();
	}

	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			pendingResponses.forEach((requestId, sink) -> sink.error(new AcpException("Session " + id + " closed")));
			pendingResponses.clear();
			return transport.closeGracefully();
		});
	}

	public void close() {
		closeGracefully().subscribe(null, error -> logger.error("Session {} failed to close", id, error));
	}

}
