/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.jsonrpc;

import java.math.BigInteger;
import java.util.Map;

import com.agentclientprotocol.gateway.jsonrpc.InvalidEnvelopeException.Kind;
import com.agentclientprotocol.gateway.spec.AcpSchema;
import com.agentclientprotocol.gateway.spec.AcpSchema.JSONRPCMessage;
import io.modelcontextprotocol.json.McpJsonMapper;

/**
 * Classifies decoded JSON values into JSON-RPC envelopes and enforces the envelope rules.
 *
 * <p>
 * A value with a {@code method} member is a request when it also has an {@code id}
 * member, otherwise a notification. A value without {@code method} but with {@code id} and
 * a {@code result} or {@code error} member is a response. Everything else is invalid.
 * </p>
 *
 * @author Mark Pollack
 */
public final class JsonRpcEnvelopes {

	private JsonRpcEnvelopes() {
	}

	/**
	 * Validates and converts a decoded JSON value.
	 * @param jsonMapper mapper used to bind the typed envelope
	 * @param value the decoded frame
	 * @return the typed message
	 * @throws InvalidEnvelopeException if the value breaks an envelope rule
	 */
	public static JSONRPCMessage classify(McpJsonMapper jsonMapper, Object value) {
		if (!(value instanceof Map<?, ?> map)) {
			throw new InvalidEnvelopeException(Kind.REQUEST, null, "Invalid Request: message must be a JSON object");
		}

		boolean hasMethod = map.containsKey("method");
		boolean hasId = map.containsKey("id");

		if (!hasMethod && hasId && (map.containsKey("result") || map.containsKey("error"))) {
			return classifyResponse(jsonMapper, map);
		}

		Kind kind = hasId ? Kind.REQUEST : Kind.NOTIFICATION;
		Object id = hasId ? normalizeId(map.get("id")) : null;

		if (hasId && id == null) {
			throw new InvalidEnvelopeException(kind, null, "Invalid Request: id must be a string or an integer");
		}
		checkVersion(map, kind, id);
		Object method = map.get("method");
		if (!(method instanceof String name) || name.isEmpty()) {
			throw new InvalidEnvelopeException(kind, id, "Invalid Request: method must be a non-empty string");
		}
		Object params = map.get("params");
		if (params != null && !(params instanceof Map)) {
			throw new InvalidEnvelopeException(kind, id, "Invalid Request: params must be an object");
		}

		if (hasId) {
			return new AcpSchema.JSONRPCRequest(AcpSchema.JSONRPC_VERSION, id, name, params);
		}
		return new AcpSchema.JSONRPCNotification(AcpSchema.JSONRPC_VERSION, name, params);
	}

	private static JSONRPCMessage classifyResponse(McpJsonMapper jsonMapper, Map<?, ?> map) {
		Object id = normalizeId(map.get("id"));
		checkVersion(map, Kind.RESPONSE, id);
		if (map.containsKey("result") && map.get("error") != null) {
			throw new InvalidEnvelopeException(Kind.RESPONSE, id, "Invalid Response: both result and error present");
		}
		AcpSchema.JSONRPCError error = null;
		if (map.get("error") != null) {
			try {
				error = jsonMapper.convertValue(map.get("error"), AcpSchema.JSONRPCError.class);
			}
			catch (RuntimeException e) {
				throw new InvalidEnvelopeException(Kind.RESPONSE, id, "Invalid Response: malformed error member");
			}
		}
		return new AcpSchema.JSONRPCResponse(AcpSchema.JSONRPC_VERSION, id, map.get("result"), error);
	}

	private static void checkVersion(Map<?, ?> map, Kind kind, Object id) {
		if (!AcpSchema.JSONRPC_VERSION.equals(map.get("jsonrpc"))) {
			throw new InvalidEnvelopeException(kind, id, "Invalid Request: jsonrpc must be \"2.0\"");
		}
	}

	/**
	 * Normalizes a correlation id so equal ids compare equal regardless of the integer type
	 * the JSON parser picked.
	 * @param id the raw id
	 * @return a String, a Long, or null when the id is neither a string nor an integer
	 */
	public static Object normalizeId(Object id) {
		if (id instanceof String) {
			return id;
		}
		if (id instanceof Integer || id instanceof Long || id instanceof Short || id instanceof Byte) {
			return ((Number) id).longValue();
		}
		if (id instanceof BigInteger big && big.bitLength() < 64) {
			return big.longValue();
		}
		return null;
	}

}
