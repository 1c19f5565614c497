package com.gt.studyscheduler.analytics;

import com.gt.studyscheduler.model.*;
import com.gt.studyscheduler.store.StudyStateDao;
import com.gt.studyscheduler.util.LimitUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

@Component
public class AnalyticsEngine {

    public static final int DEFAULT_ANALYTICS_DAYS = 30;
    public static final int DEFAULT_PERFORMANCE_DAYS = 7;
    public static final int DEFAULT_CARD_LIMIT = 10;

    static final double STRUGGLE_QUALITY_THRESHOLD = 3;
    static final int STRUGGLE_MIN_REVIEWS = 3;
    static final double MASTERED_QUALITY_THRESHOLD = 4.5;
    static final int MASTERED_MIN_INTERVAL = 30;

    private static final double IMPROVING_STREAK_RATIO = 1.1;
    private static final double DECLINING_STREAK_RATIO = 0.9;
    private static final long MILLIS_PER_MINUTE = 60_000;

    private final StudyStateDao studyStateDao;
    private final Clock clock;

    @Autowired
    public AnalyticsEngine(StudyStateDao studyStateDao, Clock clock) {
        this.studyStateDao = studyStateDao;
        this.clock = clock;
    }

    public StudyAnalytics getStudyAnalytics(int days) {
        return getStudyAnalytics(studyStateDao.loadStudySessions(), days);
    }

    /**
     * Summarises the finished sessions started within the last {@code days} days. {@code streakDays} counts
     * consecutive days with at least one session, ending today; a day without a session, today included, ends it.
     */
    public StudyAnalytics getStudyAnalytics(List<StudySession> sessions, int days) {
        LimitUtil.requireNonNegative(days, "days");

        ZoneId zone = clock.getZone();
        Instant cutoff = ZonedDateTime.now(clock).minusDays(days).toInstant();

        List<StudySession> recentSessions = sessions.stream()
                .filter(session -> session.startTime() != null && !session.startTime().isBefore(cutoff) && session.isFinished())
                .toList();

        if (recentSessions.isEmpty()) {
            return StudyAnalytics.EMPTY;
        }

        int totalCardsStudied = recentSessions.stream().mapToInt(session -> session.cardsStudied().size()).sum();
        int totalCorrectCards = recentSessions.stream().mapToInt(StudySession::correctCards).sum();
        long totalStudyTimeMs = recentSessions.stream()
                .mapToLong(session -> session.sessionDuration() == null ? 0 : session.sessionDuration())
                .sum();

        double averageAccuracy = totalCardsStudied > 0 ? (double) totalCorrectCards / totalCardsStudied * 100 : 0;

        Set<LocalDate> studyDates = recentSessions.stream()
                .map(session -> LocalDate.ofInstant(session.startTime(), zone))
                .collect(Collectors.toSet());

        int streakDays = 0;
        LocalDate today = LocalDate.now(clock);
        for (int i = 0; i < days; i++) {
            if (studyDates.contains(today.minusDays(i))) {
                streakDays++;
            } else {
                break;
            }
        }

        return new StudyAnalytics(
                recentSessions.size(),
                totalCardsStudied,
                Math.round(averageAccuracy),
                Math.round((double) totalStudyTimeMs / MILLIS_PER_MINUTE),
                streakDays);
    }

    // Reviewed at least three times with a mean quality below a passing grade, lowest first
    public List<CardMemoryState> getStruggleCards(MemorySnapshot snapshot, int limit) {
        LimitUtil.requireNonNegative(limit, "limit");

        return snapshot.states()
                .stream()
                .filter(state -> state.averageQuality() < STRUGGLE_QUALITY_THRESHOLD && state.totalReviews() >= STRUGGLE_MIN_REVIEWS)
                .sorted(Comparator.comparingDouble(CardMemoryState::averageQuality))
                .limit(limit)
                .toList();
    }

    public List<CardMemoryState> getMasteredCards(MemorySnapshot snapshot, int limit) {
        LimitUtil.requireNonNegative(limit, "limit");

        return snapshot.states()
                .stream()
                .filter(state -> state.averageQuality() >= MASTERED_QUALITY_THRESHOLD && state.interval() >= MASTERED_MIN_INTERVAL)
                .sorted(Comparator.comparingInt(CardMemoryState::interval).reversed())
                .limit(limit)
                .toList();
    }

    public RecentPerformance getRecentPerformance(MemorySnapshot snapshot, int days) {
        LimitUtil.requireNonNegative(days, "days");
        Instant cutoff = ZonedDateTime.now(clock).minusDays(days).toInstant();

        List<CardMemoryState> recentStates = snapshot.states()
                .stream()
                .filter(state -> state.lastReviewDate() != null && !state.lastReviewDate().isBefore(cutoff))
                .toList();

        if (recentStates.isEmpty()) {
            return RecentPerformance.NONE;
        }

        double averageQuality = recentStates.stream().mapToDouble(CardMemoryState::averageQuality).average().orElse(0);
        double recentAverageStreak = recentStates.stream().mapToInt(CardMemoryState::streak).average().orElse(0);
        double overallAverageStreak = snapshot.states().stream().mapToInt(CardMemoryState::streak).average().orElse(0);

        StreakTrend streakTrend = StreakTrend.Stable;
        if (recentAverageStreak > overallAverageStreak * IMPROVING_STREAK_RATIO) {
            streakTrend = StreakTrend.Improving;
        } else if (recentAverageStreak < overallAverageStreak * DECLINING_STREAK_RATIO) {
            streakTrend = StreakTrend.Declining;
        }

        return new RecentPerformance(averageQuality, recentStates.size(), streakTrend);
    }

    public List<CardMemoryState> getStruggleCards(int limit) {
        return getStruggleCards(studyStateDao.loadMemorySnapshot(), limit);
    }

    public List<CardMemoryState> getMasteredCards(int limit) {
        return getMasteredCards(studyStateDao.loadMemorySnapshot(), limit);
    }

    public RecentPerformance getRecentPerformance(int days) {
        return getRecentPerformance(studyStateDao.loadMemorySnapshot(), days);
    }
}
