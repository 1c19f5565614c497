package com.gt.studyscheduler.review;

import com.gt.studyscheduler.exception.InvalidRequestException;
import com.gt.studyscheduler.exception.SessionStateException;
import com.gt.studyscheduler.memory.MemoryModel;
import com.gt.studyscheduler.model.*;
import com.gt.studyscheduler.store.StudyStateDao;
import com.gt.studyscheduler.util.LimitUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Component
public class StudySessionService {

    private static final Logger log = LoggerFactory.getLogger(StudySessionService.class);

    public static final int DEFAULT_RECENT_SESSION_COUNT = 10;

    private final SessionComposer sessionComposer;
    private final DueSelector dueSelector;
    private final StudyStateDao studyStateDao;
    private final Clock clock;

    @Autowired
    public StudySessionService(SessionComposer sessionComposer,
                               DueSelector dueSelector,
                               StudyStateDao studyStateDao,
                               Clock clock) {
        this.sessionComposer = sessionComposer;
        this.dueSelector = dueSelector;
        this.studyStateDao = studyStateDao;
        this.clock = clock;
    }

    public StudySessionPlan planSession(List<String> allItemIds, StudySessionOptions options) {
        return sessionComposer.createStudySession(allItemIds, studyStateDao.loadMemorySnapshot(), options);
    }

    public List<CardMemoryState> getCardsDueForReview(int limit) {
        return dueSelector.getCardsDueForReview(studyStateDao.loadMemorySnapshot(), limit);
    }

    public StudySession startSession(String sessionId) {
        log.info("Starting study session {}", sessionId);

        return new StudySession(sessionId, clock.instant(), null, List.of(), List.of(), 0, 0, null, null);
    }

    /**
     * Applies the result to the stored memory state and returns the session with the result appended. The stored
     * state is updated even when the session is later abandoned.
     */
    public StudySession recordResult(StudySession session, StudyResult result) {
        if (session == null || result == null || result.itemId() == null) {
            throw new InvalidRequestException("A study result needs a session and an item id");
        }

        if (session.isFinished()) {
            throw new SessionStateException("Study session " + session.sessionId() + " has already ended");
        }

        MemoryModel.validateQuality(result.quality());

        MemorySnapshot updatedSnapshot = sessionComposer.processStudyResult(result, studyStateDao.loadMemorySnapshot());
        if (!studyStateDao.saveMemorySnapshot(updatedSnapshot)) {
            log.warn("Memory state for item {} in session {} was not saved", result.itemId(), session.sessionId());
        }

        List<String> cardsStudied = new ArrayList<>(session.cardsStudied());
        cardsStudied.add(result.itemId());

        List<StudyResult> results = new ArrayList<>(session.results());
        results.add(result);

        int correctCards = (int) results.stream().filter(StudyResult::isCorrect).count();

        return new StudySession(session.sessionId(), session.startTime(), null, cardsStudied, results,
                results.size(), correctCards, null, null);
    }

    public StudySession completeSession(StudySession session) {
        if (session == null || session.sessionId() == null || session.startTime() == null) {
            throw new InvalidRequestException("A completed study session needs a session id and a start time");
        }

        if (session.isFinished()) {
            log.info("Study session {} already completed", session.sessionId());
            return session;
        }

        Instant endTime = clock.instant();
        StudySession completedSession = new StudySession(
                session.sessionId(),
                session.startTime(),
                endTime,
                session.cardsStudied(),
                session.results(),
                session.totalCards(),
                session.correctCards(),
                calculateAverageResponseTime(session.results()),
                Duration.between(session.startTime(), endTime).toMillis());

        List<StudySession> sessions = new ArrayList<>(studyStateDao.loadStudySessions());
        sessions.removeIf(storedSession -> session.sessionId().equals(storedSession.sessionId()));
        sessions.add(completedSession);

        if (!studyStateDao.saveStudySessions(sessions)) {
            log.warn("Completed study session {} was not added to the session history", session.sessionId());
        }

        log.info("Completed study session {}: {} of {} cards correct", session.sessionId(),
                completedSession.correctCards(), completedSession.totalCards());

        return completedSession;
    }

    public List<StudySession> getRecentSessions(int limit) {
        LimitUtil.requireNonNegative(limit, "limit");

        return studyStateDao.loadStudySessions()
                .stream()
                .sorted(Comparator.comparing(StudySession::startTime, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())).reversed())
                .limit(limit)
                .toList();
    }

    public boolean clearStudySessions() {
        log.info("Clearing study session history");

        return studyStateDao.clearStudySessions();
    }

    public StudyStats getStudyStats() {
        return sessionComposer.getStudyStats(studyStateDao.loadMemorySnapshot());
    }

    private Double calculateAverageResponseTime(List<StudyResult> results) {
        List<Long> responseTimes = results.stream()
                .map(StudyResult::responseTime)
                .filter(Objects::nonNull)
                .toList();

        if (responseTimes.isEmpty()) {
            return null;
        }

        return responseTimes.stream().mapToLong(Long::longValue).average().orElse(0);
    }
}
