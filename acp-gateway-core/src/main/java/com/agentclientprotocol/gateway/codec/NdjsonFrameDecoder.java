/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.codec;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;
import io.modelcontextprotocol.json.TypeRef;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Incremental decoder for newline-delimited JSON.
 *
 * <p>
 * Input arrives in arbitrary chunks. {@link #feed(String)} appends to an internal buffer,
 * returns every complete line (trimmed, blank lines skipped) and keeps the unterminated
 * remainder for the next call. Byte input keeps an incomplete UTF-8 sequence at the end of
 * a chunk until the rest arrives.
 * </p>
 *
 * <p>
 * Instances are not thread-safe; each connection owns one.
 * </p>
 *
 * @author Mark Pollack
 */
public class NdjsonFrameDecoder {

	private static final Logger logger = LoggerFactory.getLogger(NdjsonFrameDecoder.class);

	private static final TypeRef<Object> VALUE_TYPE_REF = new TypeRef<>() {
	};

	private final McpJsonMapper jsonMapper;

	private final StringBuilder buffer = new StringBuilder();

	private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder()
		.onMalformedInput(CodingErrorAction.REPLACE)
		.onUnmappableCharacter(CodingErrorAction.REPLACE);

	private ByteBuffer pendingBytes = ByteBuffer.allocate(0);

	private long lineCount;

	public NdjsonFrameDecoder(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Appends a text chunk and returns the raw frames it completed.
	 * @param chunk the received text
	 * @return complete, trimmed, non-empty lines in arrival order
	 */
	public List<String> feed(String chunk) {
		if (chunk != null && !chunk.isEmpty()) {
			buffer.append(chunk);
		}
		List<String> frames = new ArrayList<>();
		int newline;
		while ((newline = buffer.indexOf("\n")) >= 0) {
			String line = buffer.substring(0, newline).trim();
			buffer.delete(0, newline + 1);
			if (!line.isEmpty()) {
				lineCount++;
				frames.add(line);
			}
		}
		return frames;
	}

	/**
	 * Appends a byte chunk, decoded as UTF-8, and returns the raw frames it completed.
	 * @param chunk the received bytes
	 * @param offset start offset in {@code chunk}
	 * @param length number of bytes to consume
	 * @return complete, trimmed, non-empty lines in arrival order
	 */
	public List<String> feed(byte[] chunk, int offset, int length) {
		ByteBuffer in = ByteBuffer.allocate(pendingBytes.remaining() + length);
		in.put(pendingBytes).put(chunk, offset, length).flip();
		CharBuffer out = CharBuffer.allocate(in.remaining() + 1);
		utf8.decode(in, out, false);
		pendingBytes = in.slice();
		out.flip();
		return feed(out.toString());
	}

	public List<String> feed(byte[] chunk) {
		return feed(chunk, 0, chunk.length);
	}

	/**
	 * Feeds a chunk and decodes every completed line as JSON. A line that is not valid
	 * JSON is reported to {@code errorHandler} and skipped; the lines after it are still
	 * decoded.
	 * @param chunk the received text
	 * @param errorHandler receives one exception per malformed line
	 * @return the successfully decoded frames
	 */
	public List<DecodedFrame> decode(String chunk, Consumer<FrameDecodeException> errorHandler) {
		List<String> lines = feed(chunk);
		List<DecodedFrame> frames = new ArrayList<>(lines.size());
		long first = lineCount - lines.size() + 1;
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			try {
				frames.add(new DecodedFrame(first + i, line, jsonMapper.readValue(line, VALUE_TYPE_REF)));
			}
			catch (IOException | RuntimeException e) {
				FrameDecodeException error = new FrameDecodeException(first + i, line, e);
				logger.error(error.getMessage());
				errorHandler.accept(error);
			}
		}
		return frames;
	}

	public List<DecodedFrame> decode(String chunk) {
		return decode(chunk, error -> {
		});
	}

	/**
	 * Returns the number of frames produced since construction or the last reset.
	 * @return the line count
	 */
	public long getLineCount() {
		return lineCount;
	}

	/**
	 * Returns whether a partial line is waiting for its newline.
	 * @return true if buffered input remains
	 */
	public boolean hasPendingInput() {
		return buffer.length() > 0 || pendingBytes.hasRemaining();
	}

	/**
	 * Discards the partial line, any pending bytes and the line count.
	 */
	public void reset() {
		buffer.setLength(0);
		pendingBytes = ByteBuffer.allocate(0);
		utf8.reset();
		lineCount = 0;
	}

}
