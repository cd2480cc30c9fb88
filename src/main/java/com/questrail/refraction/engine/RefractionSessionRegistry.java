package com.questrail.refraction.engine;

import com.questrail.refraction.config.RefractionEngineConfig;
import com.questrail.refraction.observability.NullObservabilitySink;
import com.questrail.refraction.observability.RefractionObservabilitySink;
import com.questrail.refraction.time.SystemWallClock;
import com.questrail.refraction.time.WallClock;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * RefractionSessionRegistry
 * -----------------------------------------------------------------------------
 * Addresses concurrently served examination sessions by identifier.
 *
 * <p>The registry's map is thread-safe; the sessions it hands out are not.
 * Each session must still be driven by one caller at a time. Sessions share
 * the immutable configuration and nothing else.</p>
 */
public final class RefractionSessionRegistry
{
    private final RefractionEngineConfig config;
    private final WallClock clock;
    private final RefractionObservabilitySink observabilitySink;

    private final ConcurrentMap<String, RefractionEngine> sessions = new ConcurrentHashMap<>();

    public RefractionSessionRegistry(RefractionEngineConfig config,
                                     WallClock clock,
                                     RefractionObservabilitySink observabilitySink) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.observabilitySink = Objects.requireNonNullElse(observabilitySink, NullObservabilitySink.INSTANCE);
    }

    public RefractionSessionRegistry(RefractionEngineConfig config) {
        this(config, SystemWallClock.INSTANCE, null);
    }

    /**
     * Opens a new session.
     *
     * @throws IllegalStateException if a session with this id is already open
     */
    public RefractionSession open(String sessionId) {
        Objects.requireNonNull(sessionId, "sessionId");
        RefractionEngine engine = new RefractionEngine(sessionId, config, clock, observabilitySink);
        if (sessions.putIfAbsent(sessionId, engine) != null) {
            throw new IllegalStateException("Session already open: " + sessionId);
        }
        return engine;
    }

    public Optional<RefractionSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(Objects.requireNonNull(sessionId, "sessionId")));
    }

    /**
     * Removes a session and returns its final snapshot, or empty if no such
     * session was open.
     */
    public Optional<SessionSnapshot> close(String sessionId) {
        RefractionEngine engine = sessions.remove(Objects.requireNonNull(sessionId, "sessionId"));
        return Optional.ofNullable(engine).map(RefractionEngine::snapshot);
    }

    public Set<String> openSessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }
}
