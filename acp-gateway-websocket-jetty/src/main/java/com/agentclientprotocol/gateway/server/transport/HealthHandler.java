/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.server.transport;

import java.util.LinkedHashMap;
import java.util.Map;

import com.agentclientprotocol.gateway.server.AcpGateway;
import com.agentclientprotocol.gateway.util.Assert;
import org.eclipse.jetty.http.HttpHeader;
import org.eclipse.jetty.http.HttpMethod;
import org.eclipse.jetty.http.HttpStatus;
import org.eclipse.jetty.io.Content;
import org.eclipse.jetty.server.Handler;
import org.eclipse.jetty.server.Request;
import org.eclipse.jetty.server.Response;
import org.eclipse.jetty.util.Callback;

/**
 * Answers {@code GET} on the health path with a small JSON status document. Other requests
 * are left unhandled.
 *
 * @author Mark Pollack
 */
public class HealthHandler extends Handler.Abstract {

	public static final String DEFAULT_HEALTH_PATH = "/health";

	private final AcpGateway gateway;

	private final String path;

	public HealthHandler(AcpGateway gateway, String path) {
		Assert.notNull(gateway, "Gateway must not be null");
		Assert.hasText(path, "Path must not be empty");
		this.gateway = gateway;
		this.path = path;
	}

	@Override
	public boolean handle(Request request, Response response, Callback callback) throws Exception {
		if (!HttpMethod.GET.is(request.getMethod()) || !path.equals(Request.getPathInContext(request))) {
			return false;
		}
		Map<String, Object> status = new LinkedHashMap<>();
		status.put("status", "ok");
		status.put("service", gateway.getServerInfo().name());
		status.put("version", gateway.getServerInfo().version());
		status.put("initialized", gateway.isInitialized());
		status.put("active_sessions", gateway.getSessionManager().getStats().activeSessions());
		String body = gateway.getJsonMapper().writeValueAsString(status);

		response.setStatus(HttpStatus.OK_200);
		response.getHeaders().put(HttpHeader.CONTENT_TYPE, "application/json");
		Content.Sink.write(response, true, body, callback);
		return true;
	}

}
