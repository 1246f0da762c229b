/*
 * Copyright 2025-2025 the original author or authors.
 */

package com.agentclientprotocol.gateway.session;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Supplier;

import com.agentclientprotocol.gateway.error.AcpProtocolException;
import com.agentclientprotocol.gateway.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Owns the live sessions: admission control, activity tracking and expiry.
 *
 * <p>
 * Every read and write of the session map happens under one lock, including the periodic
 * sweep, so a session touched by a client operation is either seen as fresh by the sweep
 * or removed before the operation looks it up. Sessions are immutable snapshots; callers
 * never hold a mutable reference.
 * </p>
 *
 * <p>
 * Example usage:
 * <pre>{@code
 * SessionManager sessions = SessionManager.builder()
 *     .maxSessions(10)
 *     .sessionTimeout(Duration.ofMinutes(30))
 *     .build();
 * sessions.start();
 * GatewaySession session = sessions.create("/workspace", Map.of(), null, null);
 * }</pre>
 *
 * @author Mark Pollack
 */
public class SessionManager {

	private static final Logger logger = LoggerFactory.getLogger(SessionManager.class);

	public static final int DEFAULT_MAX_SESSIONS = 100;

	public static final Duration DEFAULT_SESSION_TIMEOUT = Duration.ofHours(1);

	public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(5);

	public static final String DEFAULT_MODE = "execute";

	public static final String DEFAULT_MODEL = "qwen3:latest";

	private final Object lock = new Object();

	private final Map<String, GatewaySession> sessions = new LinkedHashMap<>();

	private final int maxSessions;

	private final Duration sessionTimeout;

	private final Duration sweepInterval;

	private final String defaultMode;

	private final String defaultModel;

	private final Clock clock;

	private final Supplier<String> idGenerator;

	private final Consumer<GatewaySession> expirationListener;

	private Scheduler sweepScheduler;

	private Disposable sweepTask;

	private SessionManager(Builder builder) {
		this.maxSessions = builder.maxSessions;
		this.sessionTimeout = builder.sessionTimeout;
		this.sweepInterval = builder.sweepInterval;
		this.defaultMode = builder.defaultMode;
		this.defaultModel = builder.defaultModel;
		this.clock = builder.clock;
		this.idGenerator = builder.idGenerator;
		this.expirationListener = builder.expirationListener;
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Starts the periodic expiry sweep. Calling it again has no effect.
	 */
	public void start() {
		synchronized (lock) {
			if (sweepTask != null) {
				return;
			}
			sweepScheduler = Schedulers.fromExecutorService(Executors.newSingleThreadScheduledExecutor(r -> {
				Thread t = new Thread(r, "acp-session-sweeper");
				t.setDaemon(true);
				return t;
			}), "session-sweeper");
			sweepTask = Flux.interval(sweepInterval, sweepInterval, sweepScheduler).subscribe(tick -> runSweep());
		}
		logger.info("Session manager started (max {} sessions, timeout {}, sweep every {})", maxSessions,
				sessionTimeout, sweepInterval);
	}

	private void runSweep() {
		try {
			int removed = sweepExpired();
			if (removed > 0) {
				logger.info("Removed {} expired session(s)", removed);
			}
		}
		catch (RuntimeException e) {
			logger.error("Session sweep failed", e);
		}
	}

	/**
	 * Stops the sweep and removes every session.
	 */
	public void stop() {
		synchronized (lock) {
			if (sweepTask != null) {
				sweepTask.dispose();
				sweepTask = null;
			}
			if (sweepScheduler != null) {
				sweepScheduler.dispose();
				sweepScheduler = null;
			}
			sessions.clear();
		}
		logger.info("Session manager stopped");
	}

	/**
	 * Creates a session.
	 * @param workingDirectory the session's working directory
	 * @param metadata client metadata, may be null
	 * @param mode initial mode, the default mode when null
	 * @param model initial model, the default model when null
	 * @return the new session
	 * @throws SessionAdmissionException when the capacity is reached or the id is taken
	 */
	public GatewaySession create(String workingDirectory, Map<String, Object> metadata, String mode, String model) {
		String sessionId = idGenerator.get();
		GatewaySession session;
		synchronized (lock) {
			if (sessions.size() >= maxSessions) {
				throw new SessionAdmissionException(SessionAdmissionException.Reason.CAPACITY,
						"Maximum sessions (" + maxSessions + ") reached");
			}
			if (sessions.containsKey(sessionId)) {
				throw new SessionAdmissionException(SessionAdmissionException.Reason.DUPLICATE_ID,
						"Session " + sessionId + " already exists");
			}
			Instant now = clock.instant();
			session = new GatewaySession(sessionId, workingDirectory, now, now, mode != null ? mode : defaultMode,
					model != null ? model : defaultModel, metadata, true, 0, 0);
			sessions.put(sessionId, session);
		}
		logger.info("Created session {} in {}", sessionId, workingDirectory);
		return session;
	}

	/**
	 * Looks up an active session and refreshes its activity time.
	 * @param sessionId the session id
	 * @return the refreshed session, empty if absent or inactive
	 */
	public Optional<GatewaySession> get(String sessionId) {
		synchronized (lock) {
			GatewaySession session = sessions.get(sessionId);
			if (session == null || !session.active()) {
				return Optional.empty();
			}
			GatewaySession touched = session.touch(clock.instant());
			sessions.put(sessionId, touched);
			return Optional.of(touched);
		}
	}

	/**
	 * Like {@link #get(String)} but fails with a protocol error. A session that is past its
	 * timeout and not yet swept is removed and reported as expired.
	 * @param sessionId the session id
	 * @return the refreshed session
	 * @throws AcpProtocolException with the session-not-found or session-expired code
	 */
	public GatewaySession require(String sessionId) {
		GatewaySession expired;
		synchronized (lock) {
			GatewaySession session = sessionId != null ? sessions.get(sessionId) : null;
			if (session == null || !session.active()) {
				throw AcpProtocolException.sessionNotFound(sessionId);
			}
			Instant now = clock.instant();
			if (!session.isExpired(now, sessionTimeout)) {
				GatewaySession touched = session.touch(now);
				sessions.put(sessionId, touched);
				return touched;
			}
			sessions.remove(sessionId);
			expired = session;
		}
		notifyExpired(expired);
		throw AcpProtocolException.sessionExpired(sessionId);
	}

	/**
	 * Applies a partial update and refreshes the activity time.
	 * @param sessionId the session id
	 * @param changes the fields to change
	 * @return the updated session, empty if absent
	 */
	public Optional<GatewaySession> update(String sessionId, SessionChanges changes) {
		synchronized (lock) {
			GatewaySession session = sessions.get(sessionId);
			if (session == null) {
				return Optional.empty();
			}
			GatewaySession updated = session.apply(changes, clock.instant());
			sessions.put(sessionId, updated);
			return Optional.of(updated);
		}
	}

	/**
	 * Removes a session.
	 * @param sessionId the session id
	 * @return true if a session was removed
	 */
	public boolean delete(String sessionId) {
		boolean removed;
		synchronized (lock) {
			removed = sessions.remove(sessionId) != null;
		}
		if (removed) {
			logger.info("Deleted session {}", sessionId);
		}
		return removed;
	}

	/**
	 * Lists the active sessions in creation order.
	 * @return a snapshot of the active sessions
	 */
	public List<GatewaySession> list() {
		synchronized (lock) {
			List<GatewaySession> active = new ArrayList<>();
			for (GatewaySession session : sessions.values()) {
				if (session.active()) {
					active.add(session);
				}
			}
			return active;
		}
	}

	/**
	 * Removes every session idle for longer than the session timeout.
	 * @return the number of sessions removed
	 */
	public int sweepExpired() {
		List<GatewaySession> expired = new ArrayList<>();
		synchronized (lock) {
			Instant now = clock.instant();
			sessions.values().removeIf(session -> {
				if (session.isExpired(now, sessionTimeout)) {
					expired.add(session);
					return true;
				}
				return false;
			});
		}
		expired.forEach(this::notifyExpired);
		return expired.size();
	}

	private void notifyExpired(GatewaySession session) {
		logger.info("Session {} expired", session.sessionId());
		if (expirationListener == null) {
			return;
		}
		try {
			expirationListener.accept(session);
		}
		catch (RuntimeException e) {
			logger.error("Expiration listener failed for session {}", session.sessionId(), e);
		}
	}

	/**
	 * Computes aggregate figures over all sessions. The session count includes cancelled
	 * sessions that are still registered, the same count admission control checks.
	 * @return the current statistics
	 */
	public SessionStats getStats() {
		synchronized (lock) {
			long messages = 0;
			long toolCalls = 0;
			for (GatewaySession session : sessions.values()) {
				messages += session.messageCount();
				toolCalls += session.toolCallCount();
			}
			return new SessionStats(sessions.size(), maxSessions, messages, toolCalls, sessionTimeout.toSeconds());
		}
	}

	public int size() {
		synchronized (lock) {
			return sessions.size();
		}
	}

	public Duration getSessionTimeout() {
		return sessionTimeout;
	}

	public int getMaxSessions() {
		return maxSessions;
	}

	/**
	 * Builder for {@link SessionManager}.
	 */
	public static class Builder {

		private int maxSessions = DEFAULT_MAX_SESSIONS;

		private Duration sessionTimeout = DEFAULT_SESSION_TIMEOUT;

		private Duration sweepInterval = DEFAULT_SWEEP_INTERVAL;

		private String defaultMode = DEFAULT_MODE;

		private String defaultModel = DEFAULT_MODEL;

		private Clock clock = Clock.systemUTC();

		private Supplier<String> idGenerator = () -> UUID.randomUUID().toString();

		private Consumer<GatewaySession> expirationListener;

		public Builder maxSessions(int maxSessions) {
			Assert.isTrue(maxSessions > 0, "Max sessions must be positive");
			this.maxSessions = maxSessions;
			return this;
		}

		public Builder sessionTimeout(Duration sessionTimeout) {
			Assert.notNull(sessionTimeout, "Session timeout must not be null");
			Assert.isTrue(!sessionTimeout.isNegative() && !sessionTimeout.isZero(), "Session timeout must be positive");
			this.sessionTimeout = sessionTimeout;
			return this;
		}

		public Builder sweepInterval(Duration sweepInterval) {
			Assert.notNull(sweepInterval, "Sweep interval must not be null");
			Assert.isTrue(!sweepInterval.isNegative() && !sweepInterval.isZero(), "Sweep interval must be positive");
			this.sweepInterval = sweepInterval;
			return this;
		}

		public Builder defaultMode(String defaultMode) {
			Assert.hasText(defaultMode, "Default mode must not be empty");
			this.defaultMode = defaultMode;
			return this;
		}

		public Builder defaultModel(String defaultModel) {
			Assert.hasText(defaultModel, "Default model must not be empty");
			this.defaultModel = defaultModel;
			return this;
		}

		/**
		 * Sets the clock used for creation and activity timestamps.
		 * @param clock the clock
		 * @return This builder for chaining
		 */
		public Builder clock(Clock clock) {
			Assert.notNull(clock, "Clock must not be null");
			this.clock = clock;
			return this;
		}

		/**
		 * Sets the generator for new session ids. Defaults to random UUIDs.
		 * @param idGenerator the id generator
		 * @return This builder for chaining
		 */
		public Builder idGenerator(Supplier<String> idGenerator) {
			Assert.notNull(idGenerator, "Id generator must not be null");
			this.idGenerator = idGenerator;
			return this;
		}

		/**
		 * Sets a callback invoked after a session is removed because it expired.
		 * @param expirationListener the listener
		 * @return This builder for chaining
		 */
		public Builder expirationListener(Consumer<GatewaySession> expirationListener) {
			this.expirationListener = expirationListener;
			return this;
		}

		public SessionManager build() {
			return new SessionManager(this);
		}

	}

}
