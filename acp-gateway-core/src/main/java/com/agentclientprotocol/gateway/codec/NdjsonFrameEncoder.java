/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.codec;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import com.agentclientprotocol.gateway.util.Assert;
import io.modelcontextprotocol.json.McpJsonMapper;

/**
 * Serializes values as compact JSON terminated by a single newline.
 *
 * @author Mark Pollack
 */
public class NdjsonFrameEncoder {

	private final McpJsonMapper jsonMapper;

	public NdjsonFrameEncoder(McpJsonMapper jsonMapper) {
		Assert.notNull(jsonMapper, "The JsonMapper can not be null");
		this.jsonMapper = jsonMapper;
	}

	/**
	 * Encodes one value as one frame.
	 * @param value the value to serialize
	 * @return the JSON text followed by {@code \n}
	 * @throws UncheckedIOException if the value cannot be serialized
	 */
	public String encode(Object value) {
		try {
			return jsonMapper.writeValueAsString(value) + "\n";
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to encode frame", e);
		}
	}

	public byte[] encodeToBytes(Object value) {
		return encode(value).getBytes(StandardCharsets.UTF_8);
	}

	/**
	 * Encodes several values back to back, equivalent to concatenating {@link #encode}.
	 * @param values the values to serialize
	 * @return the concatenated frames
	 */
	public String encodeBatch(Iterable<?> values) {
		StringBuilder sb = new StringBuilder();
		for (Object value : values) {
			sb.append(encode(value));
		}
		return sb.toString();
	}

}
