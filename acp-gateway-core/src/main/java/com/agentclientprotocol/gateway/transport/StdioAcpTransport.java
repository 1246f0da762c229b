/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
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
 * Serves one ACP connection over standard input and output. Frames are read from stdin,
 * one JSON document per line, and responses and notifications are written to stdout.
 * Logging must therefore never go to stdout.
 *
 * <p>
 * End of input terminates the connection once every frame already read has been handled
 * and the output queue has drained.
 * </p>
 *
 * @author Mark Pollack
 */
public class StdioAcpTransport implements AcpTransport {

	private static final Logger logger = LoggerFactory.getLogger(StdioAcpTransport.class);

	private static final Duration EMIT_RETRY = Duration.ofMillis(100);

	private static final Duration DRAIN_TIMEOUT = Duration.ofSeconds(5);

	private final InputStream inputStream;

	private final OutputStream outputStream;

	private final NdjsonFrameDecoder decoder;

	private final Sinks.Many<String> inboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Sinks.Many<String> outboundSink = Sinks.many().unicast().onBackpressureBuffer();

	private final Sinks.One<Void> terminationSink = Sinks.one();

	private final Scheduler inboundScheduler;

	private final Scheduler outboundScheduler;

	private final AtomicBoolean isClosing = new AtomicBoolean(false);

	private final AtomicBoolean isStarted = new AtomicBoolean(false);

	private Consumer<Throwable> exceptionHandler = t -> logger.error("Transport error", t);

	public StdioAcpTransport(McpJsonMapper jsonMapper) {
		this(jsonMapper, System.in, System.out);
	}

	/**
	 * Creates a transport over the given streams.
	 * @param jsonMapper the mapper used by the frame decoder
	 * @param inputStream source of inbound frames
	 * @param outputStream sink for outbound frames
	 */
	public StdioAcpTransport(McpJsonMapper jsonMapper, InputStream inputStream, OutputStream outputStream) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		Assert.notNull(inputStream, "The InputStream can not be null");
		Assert.notNull(outputStream, "The OutputStream can not be null");

		this.inputStream = inputStream;
		this.outputStream = outputStream;
		this.decoder = new NdjsonFrameDecoder(jsonMapper);
		this.inboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadExecutor(r -> {
			Thread t = new Thread(r, "acp-stdio-inbound");
			t.setDaemon(true);
			return t;
		}), "stdio-inbound");
		this.outboundScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadScheduledExecutor(r -> {
			Thread t = new Thread(r, "acp-stdio-outbound");
			t.setDaemon(true);
			return t;
		}), "stdio-outbound");
	}

	@Override
	public Mono<Void> start(Function<String, Mono<Void>> frameHandler) {
		if (!isStarted.compareAndSet(false, true)) {
			return Mono.error(new IllegalStateException("Already started"));
		}
		return Mono.fromRunnable(() -> {
			handleIncomingFrames(frameHandler);
			startOutboundProcessing();
			startInboundProcessing();
		});
	}

	private void handleIncomingFrames(Function<String, Mono<Void>> frameHandler) {
		inboundSink.asFlux()
			.concatMap(frame -> frameHandler.apply(frame).onErrorResume(error -> {
				logger.error("Frame handler failed", error);
				return Mono.empty();
			}))
			.doFinally(signal -> outboundSink.tryEmitComplete())
			.subscribe();
	}

	private void startInboundProcessing() {
		inboundScheduler.schedule(() -> {
			byte[] buffer = new byte[8192];
			try {
				int read;
				while (!isClosing.get() && (read = inputStream.read(buffer)) != -1) {
					for (String frame : decoder.feed(buffer, 0, read)) {
						inboundSink.emitNext(frame, Sinks.EmitFailureHandler.busyLooping(EMIT_RETRY));
					}
				}
				if (decoder.hasPendingInput()) {
					logger.warn("Input ended inside a frame, discarding the unterminated line");
					decoder.reset();
				}
				logger.debug("Reached end of input");
			}
			catch (IOException e) {
				if (!isClosing.get()) {
					logger.error("Error reading from input stream", e);
					exceptionHandler.accept(e);
				}
			}
			finally {
				isClosing.set(true);
				inboundSink.tryEmitComplete();
			}
		});
	}

	private void startOutboundProcessing() {
		outboundSink.asFlux().publishOn(outboundScheduler).doFinally(signal -> {
			terminationSink.tryEmitEmpty();
		}).subscribe(frame -> {
			try {
				outputStream.write(frame.getBytes(StandardCharsets.UTF_8));
				outputStream.flush();
			}
			catch (IOException e) {
				logger.error("Error writing frame to output stream", e);
				exceptionHandler.accept(e);
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
				return Mono.error(new IllegalStateException("Failed to enqueue frame, transport is closed", e));
			}
		});
	}

	@Override
	public Mono<Void> closeGracefully() {
		return Mono.fromRunnable(() -> {
			logger.debug("Stdio transport closing gracefully");
			isClosing.set(true);
			inboundSink.tryEmitComplete();
			if (!isStarted.get()) {
				terminationSink.tryEmitEmpty();
			}
		}).then(terminationSink.asMono().timeout(DRAIN_TIMEOUT, outboundScheduler).onErrorResume(error -> {
			logger.warn("Output did not drain before close");
			outboundSink.tryEmitComplete();
			return Mono.empty();
		})).then(Mono.fromRunnable(() -> {
			inboundScheduler.dispose();
			outboundScheduler.dispose();
			logger.debug("Stdio transport closed");
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

}
