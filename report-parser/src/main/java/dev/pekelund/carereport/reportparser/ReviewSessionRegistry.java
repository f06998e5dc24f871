package dev.pekelund.carereport.reportparser;

import dev.pekelund.carereport.events.CandidateEvent;
import dev.pekelund.carereport.pending.ReportUpload;
import dev.pekelund.carereport.review.ReviewSession;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holds the review sessions that are open in this instance. Sessions idle for longer than the
 * configured time to live are dropped the next time the registry is used.
 */
public class ReviewSessionRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReviewSessionRegistry.class);

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();
    private final Duration sessionTtl;
    private final Clock clock;

    public ReviewSessionRegistry(Duration sessionTtl, Clock clock) {
        this.sessionTtl = Objects.requireNonNull(sessionTtl, "sessionTtl");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public Entry open(ReportUpload upload, List<CandidateEvent> candidates) {
        evictExpired();
        Instant now = clock.instant();
        ReviewSession session = new ReviewSession(UUID.randomUUID().toString(), upload.profile(),
            upload.source().reportDate(), now, candidates);
        Entry entry = new Entry(session, upload, now);
        sessions.put(session.id(), entry);
        LOGGER.info("Opened review session {} with {} candidates", session.id(), candidates.size());
        return entry;
    }

    /**
     * @throws UnknownReviewSessionException when no open session has this id
     */
    public Entry get(String sessionId) {
        evictExpired();
        Entry entry = sessionId != null ? sessions.get(sessionId) : null;
        if (entry == null) {
            throw new UnknownReviewSessionException(sessionId);
        }
        entry.touch(clock.instant());
        return entry;
    }

    public void close(String sessionId) {
        if (sessions.remove(sessionId) != null) {
            LOGGER.info("Closed review session {}", sessionId);
        }
    }

    public int size() {
        evictExpired();
        return sessions.size();
    }

    private void evictExpired() {
        Instant cutoff = clock.instant().minus(sessionTtl);
        sessions.entrySet().removeIf(candidate -> {
            boolean expired = candidate.getValue().lastAccess().isBefore(cutoff);
            if (expired) {
                LOGGER.info("Review session {} expired after {} without activity", candidate.getKey(), sessionTtl);
            }
            return expired;
        });
    }

    /**
     * An open session together with the report it was extracted from.
     */
    public static final class Entry {

        private final ReviewSession session;
        private final ReportUpload upload;
        private final Set<CandidateEvent> committed = Collections.newSetFromMap(new IdentityHashMap<>());
        private volatile Instant lastAccess;
        private volatile String queuedReportId;

        private Entry(ReviewSession session, ReportUpload upload, Instant lastAccess) {
            this.session = session;
            this.upload = upload;
            this.lastAccess = lastAccess;
        }

        public ReviewSession session() {
            return session;
        }

        public ReportUpload upload() {
            return upload;
        }

        public Instant lastAccess() {
            return lastAccess;
        }

        /**
         * Id of the pending report queued for this session after an interrupted commit, or {@code null}.
         */
        public String queuedReportId() {
            return queuedReportId;
        }

        void markQueued(String reportId) {
            this.queuedReportId = reportId;
        }

        synchronized boolean isCommitted(CandidateEvent candidate) {
            return committed.contains(candidate);
        }

        synchronized void markCommitted(CandidateEvent candidate) {
            committed.add(candidate);
        }

        private void touch(Instant now) {
            this.lastAccess = now;
        }
    }
}
