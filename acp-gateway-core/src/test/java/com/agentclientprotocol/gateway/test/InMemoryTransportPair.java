/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.test;

import java.time.Duration;
import java.util.function.Consumer;
import java.util.function.Function;

import com.agentclientprotocol.gateway.spec.AcpTransport;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Two {@link AcpTransport}s connected back to back through in-memory sinks. Frames sent on
 * one side arrive at the other, one at a time and in order.
 *
 * <pre>{@code
 * InMemoryTransportPair pair = InMemoryTransportPair.create();
 * gateway.serve(pair.serverTransport()).subscribe();
 * AcpGatewayClient client = AcpGatewayClient.builder(pair.clientTransport()).build();
 * }</pre>
 *
 * @author Mark Pollack
 */
public class InMemoryTransportPair {

	private final InMemoryTransport clientTransport;

	private final InMemoryTransport serverTransport;

	private InMemoryTransportPair() {
		Sinks.Many<String> clientToServer = Sinks.many().unicast().onBackpressureBuffer();
		Sinks.Many<String> serverToClient = Sinks.many().unicast().onBackpressureBuffer();
		this.clientTransport = new InMemoryTransport(clientToServer, serverToClient);
		this.serverTransport = new InMemoryTransport(serverToClient, clientToServer);
	}

	public static InMemoryTransportPair create() {
		return new InMemoryTransportPair();
	}

	public AcpTransport clientTransport() {
		return clientTransport;
	}

	public AcpTransport serverTransport() {
		return serverTransport;
	}

	public Mono<Void> closeGracefully() {
		return Mono.when(clientTransport.closeGracefully(), serverTransport.closeGracefully());
	}

	private static class InMemoryTransport implements AcpTransport {

		private static final Duration EMIT_TIMEOUT = Duration.ofMillis(100);

		private final Sinks.Many<String> outbound;

		private final Sinks.Many<String> inbound;

		private final Sinks.One<Void> terminationSink = Sinks.one();

		private volatile boolean started = false;

		private Consumer<Throwable> exceptionHandler = t -> {
		};

		InMemoryTransport(Sinks.Many<String> outbound, Sinks.Many<String> inbound) {
			this.outbound = outbound;
			this.inbound = inbound;
		}

		@Override
		public Mono<Void> start(Function<String, Mono<Void>> frameHandler) {
			if (started) {
				return Mono.error(new IllegalStateException("Already started"));
			}
			started = true;
			return Mono.fromRunnable(() -> inbound.asFlux()
				.concatMap(frame -> frameHandler.apply(frame.endsWith("\n") ? frame.substring(0, frame.length() - 1)
						: frame))
				.doOnError(exceptionHandler::accept)
				.doFinally(signal -> terminationSink.tryEmitEmpty())
				.subscribe());
		}

		@Override
		public Mono<Void> sendFrame(String frame) {
			String line = frame.endsWith("\n") ? frame : frame + "\n";
			return Mono.fromRunnable(() -> outbound.emitNext(line, Sinks.EmitFailureHandler.busyLooping(EMIT_TIMEOUT)));
		}

		@Override
		public Mono<Void> closeGracefully() {
			return Mono.fromRunnable(() -> {
				outbound.tryEmitComplete();
				terminationSink.tryEmitEmpty();
			});
		}

		@Override
		public Mono<Void> awaitTermination() {
			return terminationSink.asMono();
		}

		@Override
		public void setExceptionHandler(Consumer<Throwable> handler) {
			this.exceptionHandler = handler;
		}

	}

}
