/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.client.transport;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

import com.agentclientprotocol.gateway.codec.NdjsonFrameDecoder;
import com.agentclientprotocol.gateway.spec.AcpTransport;
import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Client side of the ACP WebSocket transport, built on the JDK
 * {@link java.net.http.WebSocket} API. Each outbound frame is sent as one text message;
 * inbound text messages are split into frames on newlines, a message boundary also ending
 * a frame.
 *
 * @author Mark Pollack
 */
public class WebSocketAcpClientTransport implements AcpTransport {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketAcpClientTransport.class);

	public static final String DEFAULT_ACP_PATH = "/ws";

	private static final Duration EMIT_RETRY = Duration.ofMillis(100);

	private final URI serverUri;

	private final HttpClient httpClient;

	private final NdjsonFrameDecoder decoder;

	private final Sinks.Many<String> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Sinks.Many<String> outboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Sinks.One<Void> connectionReady = Sinks.one();

	private final Sinks.One<Void> terminationSink = Sinks.one();

	private final Scheduler outboundScheduler;

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private final AtomicBoolean isConnected = new AtomicBoolean(false);

	private volatile WebSocket webSocket;

	private Consumer<Throwable> exceptionHandler = t -> logger.error("Transport error", t);

	private Duration connectTimeout = Duration.ofSeconds(30);

	/**
	 * Creates a transport for the given gateway endpoint.
	 * @param serverUri the WebSocket URI, for example {@code ws://localhost:8095/ws}
	 * @param jsonMapper the mapper used by the frame decoder
	 */
	public WebSocketAcpClientTransport(URI serverUri, McpJsonMapper jsonMapper) {
		this(serverUri, jsonMapper, HttpClient.newBuilder().executor(Executors.newCachedThreadPool(r -> {
			Thread t = new Thread(r, "acp-ws-client-http");
			t.setDaemon(true);
			return t;
		})).build());
	}

	public WebSocketAcpClientTransport(URI serverUri, McpJsonMapper jsonMapper, HttpClient httpClient) {
		Assert.notNull(serverUri, "The serverUri can not be null");
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(httpClient, "The HttpClient can not be null");

		this.serverUri = serverUri;
		this.httpClient = httpClient;
		this.decoder = new NdjsonFrameDecoder(jsonMapper);
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "acp-ws-client-outbound");
			t.setDaemon(true);
			return t;
		}), "ws-client-outbound");
	}

	/**
	 * Sets the connection timeout for WebSocket establishment.
	 * @param timeout the connection timeout
	 * @return this transport
	 */
	public WebSocketAcpClientTransport connectTimeout(Duration timeout) {
		Assert.notNull(timeout, "Timeout must not be null");
		this.connectTimeout = timeout;
		return this;
	}

	@Override
	public Mono<Void> start(Function<String, Mono<Void>> frameHandler) {
		if (!isConnected.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Already connected"));
		}
		return Mono.fromFuture(() -> {
			logger.info("Connecting to ACP gateway at {}", serverUri);
			handleIncomingFrames(frameHandler);
			return httpClient.newWebSocketBuilder()
				.connectTimeout(connectTimeout)
				.buildAsync(serverUri, new AcpWebSocketListener());
		}).doOnSuccess(ws -> {
			this.webSocket = ws;
			startOutboundProcessing();
			connectionReady.tryEmitEmpty();
			logger.info("Connected to ACP gateway at {}", serverUri);
		}).doOnError(error -> {
			logger.error("Failed to connect to ACP gateway at {}", serverUri, error);
			connectionReady.tryEmitError(error);
			terminationSink.tryEmitEmpty();
			exceptionHandler.accept(error);
		}).then();
	}

	private void handleIncomingFrames(Function<String, Mono<Void>> frameHandler) {
		inboundSink.asFlux()
			.concatMap(frame -> frameHandler.apply(frame).onErrorResume(error -> {
				logger.error("Frame handler failed", error);
				return Mono.empty();
			}))
			.doFinally(signal -> {
				outboundSink.tryEmitComplete();
				terminationSink.tryEmitEmpty();
			})
			.subscribe();
	}

	private void startOutboundProcessing() {
		outboundSink.asFlux().publishOn(outboundScheduler).subscribe(frame -> {
			if (!isClosing.get() && webSocket != null) {
				try {
					logger.debug("Sending frame: {}", frame);
					webSocket.sendText(frame, true).join();
				}
				catch (RuntimeException e) {
					if (!isClosing.get()) {
						logger.error("Error sending WebSocket message", e);
						exceptionHandler.accept(e);
					}
				}
			}
		});
	}

	@Override
	public Mono<Void> sendFrame(String frame) {
		return connectionReady.asMono().then(Mono.defer(() -> {
			String line = frame.endsWith("\n") ? frame : frame + "\n";
			try {
				outboundSink.emitNext(line, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
				return Mono.empty();
			}
			catch (Sinks.EmissionException e) {
				return Mono.error(new IllegalStateException("Failed to enqueue frame, transport is closed", e));
			}
		}));
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			logger.debug("WebSocket client transport closing gracefully");
			isClosing.set(true);
			inboundSink.tryEmitComplete();
			outboundSink.tryEmitComplete();
		}).then(Mono.defer(() -> {
			WebSocket ws = this.webSocket;
			if (ws != null && !ws.isOutputClosed()) {
				return Mono.fromFuture(ws.sendClose(WebSocket.NORMAL_CLOSURE, "Client closing")).then();
			}
			return Mono.empty();
		})).onErrorResume(error -> {
			logger.debug("Close handshake failed: {}", error.getMessage());
			return Mono.empty();
		}).then(Mono.fromRunnable(() -> {
			terminationSink.tryEmitEmpty();
			outboundScheduler.dispose();
			logger.debug("WebSocket client transport closed");
		}));
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

	private class AcpWebSocketListener implements WebSocket.Listener {

		private final StringBuilder messageBuffer = new StringBuilder();

		@Override
		public void onOpen(WebSocket webSocket) {
			logger.debug("WebSocket connection opened");
			webSocket.request(1);
		}

		@Override
		public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
			messageBuffer.append(data);
			if (last) {
				String message = messageBuffer.toString();
				messageBuffer.setLength(0);
				logger.debug("Received WebSocket message: {}", message);
				String terminated = message.endsWith("\n") ? message : message + "\n";
				for (String frame : decoder.feed(terminated)) {
					if (!inboundSink.tryEmitNext(frame).isSuccess() && !isClosing.get()) {
						logger.error("Failed to enqueue inbound frame");
					}
				}
			}
			webSocket.request(1);
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
			logger.info("WebSocket connection closed: {} - {}", statusCode, reason);
			isClosing.set(true);
			inboundSink.tryEmitComplete();
			return CompletableFuture.completedFuture(null);
		}

		@Override
		public void onError(WebSocket webSocket, Throwable error) {
			if (!isClosing.get()) {
				logger.error("WebSocket error", error);
				exceptionHandler.accept(error);
			}
			isClosing.set(true);
			inboundSink.tryEmitComplete();
		}

	}

}
