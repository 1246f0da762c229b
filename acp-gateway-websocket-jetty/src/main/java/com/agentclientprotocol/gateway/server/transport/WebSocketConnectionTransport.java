/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.server.transport;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import com.agentclientprotocol.gateway.codec.NdjsonFrameDecoder;
import com.agentclientprotocol.gateway.spec.AcpTransport;
import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.eclipse.jetty.websocket.api.Callback;
import org.eclipse.jetty.websocket.api.Session;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketClose;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketError;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketMessage;
import org.eclipse.jetty.websocket.api.annotations.OnWebSocketOpen;
import org.eclipse.jetty.websocket.api.annotations.WebSocket;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;

/**
 * The transport of one accepted WebSocket connection. Inbound text messages are split into
 * frames on newlines, the end of a message also ending a frame; each outbound frame is
 * sent as one text message.
 *
 * <p>
 * Instances are created by {@link WebSocketAcpServer} for every upgrade on the ACP path.
 * The {@code onOpen} callback receives the transport once the connection is established.
 * </p>
 *
 * @author Mark Pollack
 */
public class WebSocketConnectionTransport implements AcpTransport {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketConnectionTransport.class);

	private static final Duration EMIT_RETRY = Duration.ofMillis(100);

	private final NdjsonFrameDecoder decoder;

	private final Scheduler outboundScheduler;

	private final Consumer<WebSocketConnectionTransport> onOpen;

	private final Sinks.Many<String> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Sinks.Many<String> outboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Sinks.One<Void> terminationSink = Sinks.one();

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private final AtomicBoolean isStarted = new AtomicBoolean(false);

	private Consumer<Throwable> exceptionHandler = t -> logger.error("Transport error", t);

	private volatile Session clientSession;

	/**
	 * Creates the transport of a connection that is being upgraded.
	 * @param jsonMapper the mapper used by the frame decoder
	 * @param outboundScheduler scheduler that performs the writes
	 * @param onOpen called once the WebSocket is open
	 */
	public WebSocketConnectionTransport(McpJsonMapper jsonMapper, Scheduler outboundScheduler,
			Consumer<WebSocketConnectionTransport> onOpen) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(outboundScheduler, "Outbound scheduler must not be null");
		Assert.notNull(onOpen, "Open callback must not be null");
		this.decoder = new NdjsonFrameDecoder(jsonMapper);
		this.outboundScheduler = outboundScheduler;
		this.onOpen = onOpen;
	}

	/**
	 * Returns the Jetty endpoint bound to this transport.
	 * @return a new endpoint
	 */
	public AcpWebSocketEndpoint createEndpoint() {
		return new AcpWebSocketEndpoint();
	}

	@Override
	public Mono<Void> start(Function<String, Mono<Void>> frameHandler) {
		if (!isStarted.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Already started"));
		}
		return Mono.fromRunnable(() -> {
			inboundSink.asFlux()
				.concatMap(frame -> frameHandler.apply(frame).onErrorResume(error -> {
					logger.error("Frame handler failed", error);
					return Mono.empty();
				}))
				.doFinally(signal -> outboundSink.tryEmitComplete())
				.subscribe();
			startOutboundProcessing();
		});
	}

	private void startOutboundProcessing() {
		outboundSink.asFlux().publishOn(outboundScheduler).subscribe(frame -> {
			Session session = clientSession;
			if (session == null || !session.isOpen()) {
				logger.debug("Dropping frame for closed connection: {}", frame);
				return;
			}
			try {
				logger.debug("Sending frame: {}", frame);
				session.sendText(frame, Callback.NOOP);
			}
			catch (RuntimeException e) {
				if (!isClosing.get()) {
					logger.error("Error sending WebSocket message", e);
					exceptionHandler.accept(e);
				}
			}
		});
	}

	@Override
	public Mono<Void> sendFrame(String frame) {
		return Mono.defer(() -> {
			String line = frame.endsWith("\n") ? frame : frame + "\n";
			try {
				outboundSink.emitNext(line, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
				return Mono.empty();
			}
			catch (Sinks.EmissionException e) {
				return Mono.error(new IllegalStateException("Failed to enqueue frame, connection is closed", e));
			}
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			logger.debug("WebSocket connection closing gracefully");
			isClosing.set(true);
			inboundSink.tryEmitComplete();
			outboundSink.tryEmitComplete();
			Session session = clientSession;
			if (session != null && session.isOpen()) {
				session.close();
			}
			terminationSink.tryEmitEmpty();
		});
	}

	@Override
	public Mono<Void> awaitTermination() {
		return terminationSink.asMono();
	}

	@Override
	public void setExceptionHandler(Consumer<Throwable> handler) {
		Assert.notNull(handler, "Handler must not be null");
		this.exceptionHandler = handler;
	}

	private void terminate() {
		isClosing.set(true);
		clientSession = null;
		inboundSink.tryEmitComplete();
		terminationSink.tryEmitEmpty();
	}

	/**
	 * Jetty endpoint for one client connection.
	 */
	@WebSocket
	public class AcpWebSocketEndpoint {

		@OnWebSocketOpen
		public void onOpen(Session session) {
			logger.info("WebSocket client connected from {}", session.getRemoteSocketAddress());
			clientSession = session;
			onOpen.accept(WebSocketConnectionTransport.this);
		}

		@OnWebSocketMessage
		public void onMessage(Session session, String message) {
			logger.debug("Received WebSocket message: {}", message);
			String terminated = message.endsWith("\n") ? message : message + "\n";
			for (String frame : decoder.feed(terminated)) {
				if (!inboundSink.tryEmitNext(frame).isSuccess() && !isClosing.get()) {
					logger.error("Failed to enqueue inbound frame");
				}
			}
		}

		@OnWebSocketClose
		public void onClose(Session session, int statusCode, String reason) {
			logger.info("WebSocket client disconnected: {} - {}", statusCode, reason);
			terminate();
		}

		@OnWebSocketError
		public void onError(Session session, Throwable error) {
			if (!isClosing.get()) {
				logger.error("WebSocket error", error);
				exceptionHandler.accept(error);
			}
			terminate();
		}

	}

}
