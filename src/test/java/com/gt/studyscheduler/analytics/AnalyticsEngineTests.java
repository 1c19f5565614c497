package com.gt.studyscheduler.analytics;

import com.gt.studyscheduler.model.*;
import com.gt.studyscheduler.store.StudyStateDao;
import com.gt.studyscheduler.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.springframework.test.context.junit.jupiter.SpringExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static com.gt.studyscheduler.util.TestUtils.NOW;
import static com.gt.studyscheduler.util.TestUtils.cardState;
import static com.gt.studyscheduler.util.TestUtils.finishedSession;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(SpringExtension.class)
public class AnalyticsEngineTests {

    private static final double TOLERANCE = 1e-9;

    private AnalyticsEngine analyticsEngine;

    @Mock private StudyStateDao studyStateDao;

    @BeforeEach
    public void setup() {
        analyticsEngine = new AnalyticsEngine(studyStateDao, TestUtils.FIXED_CLOCK);
    }

    @Test
    public void testGetStudyAnalytics() {
        Instant today = Instant.parse("2026-03-10T09:00:00Z");
        List<StudySession> sessions = List.of(
                finishedSession("session-1", today, 10, 8, Duration.ofMinutes(20).toMillis()),
                finishedSession("session-2", today.minus(Duration.ofDays(1)), 5, 4, Duration.ofMinutes(10).toMillis()),
                finishedSession("session-3", today.minus(Duration.ofDays(2)), 5, 4, Duration.ofMinutes(10).toMillis()),
                // no session on day 3, so the streak stops at 3
                finishedSession("session-4", today.minus(Duration.ofDays(4)), 5, 4, Duration.ofMinutes(5).toMillis()),
                finishedSession("session-old", today.minus(Duration.ofDays(40)), 50, 0, Duration.ofMinutes(90).toMillis()),
                new StudySession("session-unfinished", today, null, List.of("card-1"), List.of(), 1, 0, null, null));
        when(studyStateDao.loadStudySessions()).thenReturn(sessions);

        StudyAnalytics analytics = analyticsEngine.getStudyAnalytics(30);

        assertEquals(new StudyAnalytics(4, 25, 80, 45, 3), analytics);
    }

    @Test
    public void testGetStudyAnalytics_NoSessionToday() {
        List<StudySession> sessions = List.of(
                finishedSession("session-1", NOW.minus(Duration.ofDays(1)), 4, 3, 60_000),
                finishedSession("session-2", NOW.minus(Duration.ofDays(2)), 4, 3, 60_000));

        StudyAnalytics analytics = analyticsEngine.getStudyAnalytics(sessions, 30);

        assertEquals(2, analytics.sessionsCount());
        assertEquals(75, analytics.averageAccuracy());
        assertEquals(2, analytics.totalStudyTime());
        assertEquals(0, analytics.streakDays());
    }

    @Test
    public void testGetStudyAnalytics_StreakLimitedToWindow() {
        List<StudySession> sessions = List.of(
                finishedSession("session-1", NOW.minus(Duration.ofHours(1)), 1, 1, 60_000),
                finishedSession("session-2", NOW.minus(Duration.ofDays(1)), 1, 1, 60_000),
                finishedSession("session-3", NOW.minus(Duration.ofDays(2)), 1, 1, 60_000));

        assertEquals(2, analyticsEngine.getStudyAnalytics(sessions, 2).streakDays());
    }

    @Test
    public void testGetStudyAnalytics_NoSessions() {
        when(studyStateDao.loadStudySessions()).thenReturn(List.of());

        assertEquals(StudyAnalytics.EMPTY, analyticsEngine.getStudyAnalytics(30));
        assertThrows(IllegalArgumentException.class, () -> analyticsEngine.getStudyAnalytics(-1));
    }

    @Test
    public void testGetStruggleCards() {
        MemorySnapshot snapshot = new MemorySnapshot(List.of(
                cardState("card-2.0", 1, 2.0, 3, 0, NOW),
                cardState("card-few-reviews", 1, 0.5, 2, 0, NOW),
                cardState("card-1.5", 1, 1.5, 5, 0, NOW),
                cardState("card-passing", 1, 3.0, 5, 1, NOW)));

        List<CardMemoryState> struggleCards = analyticsEngine.getStruggleCards(snapshot, 10);

        assertEquals(List.of("card-1.5", "card-2.0"), struggleCards.stream().map(CardMemoryState::itemId).toList());
        assertEquals(1, analyticsEngine.getStruggleCards(snapshot, 1).size());
    }

    @Test
    public void testGetMasteredCards() {
        MemorySnapshot snapshot = new MemorySnapshot(List.of(
                cardState("card-40", 40, 4.5, 8, 8, NOW),
                cardState("card-29", 29, 5.0, 8, 8, NOW),
                cardState("card-90", 90, 4.8, 10, 10, NOW),
                cardState("card-100-low-quality", 100, 4.4, 12, 12, NOW)));
        when(studyStateDao.loadMemorySnapshot()).thenReturn(snapshot);

        List<CardMemoryState> masteredCards = analyticsEngine.getMasteredCards(10);

        assertEquals(List.of("card-90", "card-40"), masteredCards.stream().map(CardMemoryState::itemId).toList());
    }

    @Test
    public void testGetRecentPerformance_Improving() {
        MemorySnapshot snapshot = new MemorySnapshot(List.of(
                cardState("card-1", 10, 4.0, 6, 6, NOW.minus(Duration.ofDays(1))),
                cardState("card-2", 10, 3.0, 4, 4, NOW.minus(Duration.ofDays(2))),
                cardState("card-3", 1, 2.0, 3, 1, NOW.minus(Duration.ofDays(20))),
                cardState("card-4", 1, 2.0, 3, 1, NOW.minus(Duration.ofDays(30)))));

        RecentPerformance recentPerformance = analyticsEngine.getRecentPerformance(snapshot, 7);

        assertEquals(3.5, recentPerformance.averageQuality(), TOLERANCE);
        assertEquals(2, recentPerformance.cardsStudied());
        assertEquals(StreakTrend.Improving, recentPerformance.streakTrend());
    }

    @Test
    public void testGetRecentPerformance_Declining() {
        MemorySnapshot snapshot = new MemorySnapshot(List.of(
                cardState("card-1", 1, 2.0, 6, 0, NOW.minus(Duration.ofDays(1))),
                cardState("card-2", 30, 4.0, 8, 8, NOW.minus(Duration.ofDays(20)))));

        assertEquals(StreakTrend.Declining, analyticsEngine.getRecentPerformance(snapshot, 7).streakTrend());
    }

    @Test
    public void testGetRecentPerformance_Stable() {
        MemorySnapshot snapshot = new MemorySnapshot(List.of(
                cardState("card-1", 6, 4.0, 6, 3, NOW.minus(Duration.ofDays(1))),
                cardState("card-2", 6, 4.0, 6, 3, NOW.minus(Duration.ofDays(20)))));

        assertEquals(StreakTrend.Stable, analyticsEngine.getRecentPerformance(snapshot, 7).streakTrend());
    }

    @Test
    public void testGetRecentPerformance_NoRecentReviews() {
        MemorySnapshot snapshot = new MemorySnapshot(List.of(cardState("card-1", 6, 4.0, 6, 3, NOW.minus(Duration.ofDays(20)))));

        assertEquals(RecentPerformance.NONE, analyticsEngine.getRecentPerformance(snapshot, 7));
        assertEquals(new RecentPerformance(0, 0, StreakTrend.Stable), analyticsEngine.getRecentPerformance(MemorySnapshot.EMPTY, 7));
    }
}
