/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import com.agentclientprotocol.gateway.spec.AcpTransport;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

/**
 * Transport double that records every frame sent through it and lets a test push inbound
 * frames by hand.
 *
 * @author Mark Pollack
 */
public class MockAcpTransport implements AcpTransport {

	private final List<String> sentFrames = new CopyOnWriteArrayList<>();

	private final Sinks.One<Void> terminationSink = Sinks.one();

	private volatile Function<String, Mono<Void>> frameHandler;

	@Override
	public Mono<Void> start(Function<String, Mono<Void>> frameHandler) {
		this.frameHandler = frameHandler;
		return Mono.empty();
	}

	/**
	 * Delivers a frame as if it had been read from the peer.
	 * @param frame the raw frame
	 */
	public void simulateIncomingFrame(String frame) {
		frameHandler.apply(frame).block();
	}

	@Override
	public Mono<Void> sendFrame(String frame) {
		sentFrames.add(frame.endsWith("\n") ? frame : frame + "\n");
		return Mono.empty();
	}

	public List<String> getSentFrames() {
		return List.copyOf(sentFrames);
	}

	public String getLastSentFrame() {
		return sentFrames.isEmpty() ? null : sentFrames.get(sentFrames.size() - 1);
	}

	public void clearSentFrames() {
		sentFrames.clear();
	}

	public void terminate() {
		terminationSink.tryEmitEmpty();
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(this::terminate);
	}

	@Override
	public Mono<Void> awaitTermination() {
		return terminationSink.asMono();
	}

}
