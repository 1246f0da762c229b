/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.server.transport;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

import com.agentclientprotocol.gateway.server.AcpGateway;
import com.agentclientprotocol.gateway.util.Assert;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.websocket.server.WebSocketUpgradeHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Embedded Jetty server that accepts any number of ACP WebSocket connections and serves
 * each through the shared {@link AcpGateway}. Plain HTTP {@code GET} on the health path
 * reports liveness.
 *
 * <pre>{@code
 * WebSocketAcpServer server = new WebSocketAcpServer(gateway, "0.0.0.0", 8095)
 *     .idleTimeout(Duration.ofMinutes(30));
 * server.start().block();
 * server.awaitTermination().block();
 * }</pre>
 *
 * @author Mark Pollack
 */
public class WebSocketAcpServer {

	private static final Logger logger = LoggerFactory.getLogger(WebSocketAcpServer.class);

	public static final String DEFAULT_ACP_PATH = "/ws";

	public static final int DEFAULT_PORT = 8095;

	public static final long DEFAULT_MAX_TEXT_MESSAGE_SIZE = 16 * 1024 * 1024;

	private final AcpGateway gateway;

	private final String host;

	private final int port;

	private final String path;

	private final Scheduler outboundScheduler;

	private final Sinks.One<Void> terminationSink = Sinks.one();

	private final AtomicBoolean isStarted = new AtomicBoolean(false);

	private Server server;

	private ServerConnector connector;

	private Duration idleTimeout = Duration.ofMinutes(30);

	private long maxTextMessageSize = DEFAULT_MAX_TEXT_MESSAGE_SIZE;

	private String healthPath = HealthHandler.DEFAULT_HEALTH_PATH;

	public WebSocketAcpServer(AcpGateway gateway, String host, int port) {
		this(gateway, host, port, DEFAULT_ACP_PATH);
	}

	/**
	 * Creates a server. Port {@code 0} binds an ephemeral port, see {@link #getPort()}.
	 * @param gateway the gateway serving every connection
	 * @param host the interface to bind
	 * @param port the port to listen on
	 * @param path the WebSocket endpoint path
	 */
	public WebSocketAcpServer(AcpGateway gateway, String host, int port, String path) {
		Assert.notNull(gateway, "Gateway must not be null");
		Assert.hasText(host, "Host must not be empty");
		Assert.isTrue(port >= 0 && port <= 65535, "Port must be between 0 and 65535");
		Assert.hasText(path, "Path must not be empty");

		this.gateway = gateway;
		this.host = host;
		this.port = port;
		this.path = path;
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "acp-ws-server-outbound");
			t.setDaemon(true);
			return t;
		}), "ws-server-outbound");
	}

	public WebSocketAcpServer idleTimeout(Duration timeout) {
		Assert.notNull(timeout, "Idle timeout must not be null");
		this.idleTimeout = timeout;
		return this;
	}

	public WebSocketAcpServer maxTextMessageSize(long maxTextMessageSize) {
		Assert.isTrue(maxTextMessageSize > 0, "Max message size must be positive");
		this.maxTextMessageSize = maxTextMessageSize;
		return this;
	}

	public WebSocketAcpServer healthPath(String healthPath) {
		Assert.hasText(healthPath, "Health path must not be empty");
		this.healthPath = healthPath;
		return this;
	}

	public Mono<Void> start() {
		if (!isStarted.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Already started"));
		}
		return Mono.fromCallable(() -> {
			logger.info("Starting ACP WebSocket server on {}:{} at path {}", host, port, path);

			server = new Server();
			connector = new ServerConnector(server);
			connector.setHost(host);
			connector.setPort(port);
			server.addConnector(connector);

			WebSocketUpgradeHandler wsHandler = WebSocketUpgradeHandler.from(server, container -> {
				container.setIdleTimeout(idleTimeout);
				container.setMaxTextMessageSize(maxTextMessageSize);
				container.addMapping(path, (request, response, callback) -> new WebSocketConnectionTransport(
						gateway.getJsonMapper(), outboundScheduler, this::serve)
					.createEndpoint());
			});
			wsHandler.setHandler(new HealthHandler(gateway, healthPath));
			server.setHandler(wsHandler);

			server.start();
			logger.info("ACP WebSocket server listening on port {}", connector.getLocalPort());
			return null;
		}).then();
	}

	private void serve(WebSocketConnectionTransport transport) {
		gateway.serve(transport)
			.subscribe(null, error -> logger.error("Connection ended with an error", error));
	}

	/**
	 * Returns the bound port, or the configured one before {@link #start()}.
	 * @return the port number
	 */
	public int getPort() {
		return connector != null && connector.getLocalPort() > 0 ? connector.getLocalPort() : port;
	}

	public String getPath() {
		return path;
	}

	/**
	 * Completes once the server has been stopped.
	 * @return a Mono signalling termination
	 */
	public Mono<Void> awaitTermination() {
		return terminationSink.asMono();
	}

	public Mono<Void> closeGracefully() {
		return Mono.fromCallable(() -> {
			logger.info("Stopping ACP WebSocket server");
			if (server != null) {
				server.stop();
			}
			return null;
		}).then(Mono.fromRunnable(() -> {
			outboundScheduler.dispose();
			terminationSink.tryEmitEmpty();
			logger.debug("ACP WebSocket server stopped");
		}));
	}

}
