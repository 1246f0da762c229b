/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.codec;

/**
 * A frame that decoded successfully.
 *
 * @param lineNumber 1-based line number since the last reset
 * @param raw the trimmed line as received
 * @param value the decoded JSON value (map, list, string, number, boolean or null)
 */
public record DecodedFrame(long lineNumber, String raw, Object value) {
}
