package com.adaptivetutor.session;

import com.adaptivetutor.config.SessionEngineConfig;
import com.adaptivetutor.domain.model.LearningSession;
import com.adaptivetutor.domain.model.SessionSnapshot;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Owns the live set of learning sessions. Injected into the engine; there is no static registry.
 *
 * <p>Live sessions sit in a {@link ConcurrentHashMap} keyed by session ID (safe concurrent
 * insert/lookup/remove). When a session ends it is moved, as a frozen snapshot, into a
 * bounded retention map so that the final state stays queryable. The oldest ended session is
 * evicted once retention is full.
 *
 * <p>Ended IDs are remembered in a second, much larger bounded set so that a repeated end is
 * still recognised as a no-op after the snapshot itself has been evicted.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    static final int DEFAULT_ENDED_ID_RETENTION = 100_000;

    private final ConcurrentHashMap<String, LearningSession> liveSessions = new ConcurrentHashMap<>();

    /** Ended sessions in end order, oldest first. Guarded by its own monitor. */
    private final Map<String, SessionSnapshot> endedSessions;

    /** IDs of ended sessions, oldest first; outlives the snapshots. */
    private final Set<String> endedIds;

    @Autowired
    public SessionStore(SessionEngineConfig sessionEngineConfig) {
        this(sessionEngineConfig.getEndedRetention(), sessionEngineConfig.getEndedIdRetention());
    }

    public SessionStore(int endedRetention) {
        this(endedRetention, Math.max(endedRetention, DEFAULT_ENDED_ID_RETENTION));
    }

    public SessionStore(int endedRetention, int endedIdRetention) {
        this.endedSessions = Collections.synchronizedMap(boundedMap(endedRetention));
        this.endedIds = Collections.synchronizedSet(Collections.newSetFromMap(boundedMap(endedIdRetention)));
    }

    private static <V> Map<String, V> boundedMap(int capacity) {
        return new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, V> eldest) {
                return size() > capacity;
            }
        };
    }

    /**
     * Registers a new live session.
     *
     * @throws IllegalStateException if the ID is already in use
     */
    public void add(LearningSession session) {
        LearningSession existing = liveSessions.putIfAbsent(session.getId(), session);
        if (existing != null) {
            throw new IllegalStateException("Session ID collision: " + session.getId());
        }
    }

    public Optional<LearningSession> find(String sessionId) {
        return Optional.ofNullable(liveSessions.get(sessionId));
    }

    /**
     * Moves an ended session out of the live map and into retention.
     *
     * @return the frozen snapshot, or empty if the session was not live
     */
    public Optional<SessionSnapshot> retire(String sessionId) {
        LearningSession live = liveSessions.get(sessionId);
        if (live == null) {
            return Optional.empty();
        }
        // retained before removal: a concurrent lookup always finds it in one of the two maps
        SessionSnapshot snapshot = live.toSnapshot();
        endedIds.add(sessionId);
        endedSessions.put(sessionId, snapshot);
        liveSessions.remove(sessionId, live);
        log.debug("Session {} retired ({} live, {} retained)", sessionId, liveSessions.size(), endedSessions.size());
        return Optional.of(snapshot);
    }

    public Optional<SessionSnapshot> findEnded(String sessionId) {
        return Optional.ofNullable(endedSessions.get(sessionId));
    }

    /** True while the ID is remembered as ended, which can outlast its snapshot. */
    public boolean isEnded(String sessionId) {
        return endedIds.contains(sessionId);
    }

    /** Retained ended snapshots, oldest first. */
    public List<SessionSnapshot> endedSnapshots() {
        synchronized (endedSessions) {
            return new ArrayList<>(endedSessions.values());
        }
    }

    /** Unmodifiable view of live sessions, for sweeps. */
    public Collection<LearningSession> liveSessions() {
        return Collections.unmodifiableCollection(liveSessions.values());
    }

    public int liveCount() {
        return liveSessions.size();
    }

    public int endedCount() {
        return endedSessions.size();
    }
}
