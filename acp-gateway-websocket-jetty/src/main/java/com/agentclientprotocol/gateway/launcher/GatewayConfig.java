/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.launcher;

import java.time.Duration;
import java.util.Locale;
import java.util.function.UnaryOperator;

import com.agentclientprotocol.gateway.util.Assert;

/**
 * Launcher settings. Each value is looked up as the system property {@code acp.gateway.<key>}
 * and then as the environment variable {@code ACP_GATEWAY_<KEY>}, with dots and dashes
 * turned into underscores.
 *
 * @param transport {@code websocket} or {@code stdio}
 * @param host interface the WebSocket server binds
 * @param port WebSocket server port
 * @param path WebSocket endpoint path
 * @param workingDirectory default session working directory
 * @param sessionTimeout idle time after which a session expires
 * @param maxSessions concurrent session limit
 * @param sweepInterval period of the expiry sweep
 * @param requestTimeout deadline for outbound requests
 * @param toolErrorHeuristic whether error-looking tool output is flagged
 * @author Mark Pollack
 */
public record GatewayConfig(Transport transport, String host, int port, String path, String workingDirectory,
		Duration sessionTimeout, int maxSessions, Duration sweepInterval, Duration requestTimeout,
		boolean toolErrorHeuristic) {

	public static final String PROPERTY_PREFIX = "acp.gateway.";

	public static final String ENV_PREFIX = "ACP_GATEWAY_";

	/**
	 * How the gateway talks to its clients.
	 */
	public enum Transport {

		WEBSOCKET, STDIO

	}

	public GatewayConfig {
		Assert.notNull(transport, "Transport must not be null");
		Assert.hasText(host, "Host must not be empty");
		Assert.isTrue(port >= 0 && port <= 65535, "Port must be between 0 and 65535");
		Assert.hasText(path, "Path must not be empty");
		Assert.hasText(workingDirectory, "Working directory must not be empty");
		Assert.isTrue(maxSessions > 0, "Max sessions must be positive");
	}

	/**
	 * Reads the configuration from system properties and the environment.
	 * @return the configuration
	 */
	public static GatewayConfig load() {
		return from(System::getProperty, System::getenv);
	}

	/**
	 * Reads the configuration from the given lookups.
	 * @param properties property lookup, keyed by {@code acp.gateway.<key>}
	 * @param environment environment lookup, keyed by {@code ACP_GATEWAY_<KEY>}
	 * @return the configuration
	 * @throws IllegalArgumentException when a value cannot be parsed
	 */
	public static GatewayConfig from(UnaryOperator<String> properties, UnaryOperator<String> environment) {
		Lookup lookup = new Lookup(properties, environment);
		return new GatewayConfig(lookup.transport("transport", Transport.WEBSOCKET),
				lookup.string("host", "0.0.0.0"), lookup.integer("port", 8095), lookup.string("path", "/ws"),
				lookup.string("working-directory", "."), lookup.seconds("session-timeout", 3600),
				lookup.integer("max-sessions", 100), lookup.seconds("sweep-interval", 300),
				lookup.seconds("request-timeout", 30), lookup.bool("tool-error-heuristic", true));
	}

	private static final class Lookup {

		private final UnaryOperator<String> properties;

		private final UnaryOperator<String> environment;

		Lookup(UnaryOperator<String> properties, UnaryOperator<String> environment) {
			this.properties = properties;
			this.environment = environment;
		}

		String string(String key, String defaultValue) {
			String value = properties.apply(PROPERTY_PREFIX + key);
			if (!Assert.hasText(value)) {
				value = environment.apply(ENV_PREFIX + key.replace('-', '_').replace('.', '_').toUpperCase(Locale.ROOT));
			}
			return Assert.hasText(value) ? value.trim() : defaultValue;
		}

		int integer(String key, int defaultValue) {
			String value = string(key, null);
			if (value == null) {
				return defaultValue;
			}
			try {
				return Integer.parseInt(value);
			}
			catch (NumberFormatException e) {
				throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", e);
			}
		}

		Duration seconds(String key, long defaultSeconds) {
			long seconds = integer(key, (int) defaultSeconds);
			Assert.isTrue(seconds > 0, key + " must be positive");
			return Duration.ofSeconds(seconds);
		}

		boolean bool(String key, boolean defaultValue) {
			String value = string(key, null);
			if (value == null) {
				return defaultValue;
			}
			if ("true".equalsIgnoreCase(value)) {
				return true;
			}
			if ("false".equalsIgnoreCase(value)) {
				return false;
			}
			throw new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'");
		}

		Transport transport(String key, Transport defaultValue) {
			String value = string(key, null);
			if (value == null) {
				return defaultValue;
			}
			try {
				return Transport.valueOf(value.toUpperCase(Locale.ROOT));
			}
			catch (IllegalArgumentException e) {
				throw new IllegalArgumentException("Unknown transport '" + value + "', expected websocket or stdio", e);
			}
		}

	}

}
