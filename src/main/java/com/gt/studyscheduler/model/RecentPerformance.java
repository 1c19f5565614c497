package com.gt.studyscheduler.model;

public record RecentPerformance(double averageQuality, int cardsStudied, StreakTrend streakTrend) {

    public static final RecentPerformance NONE = new RecentPerformance(0, 0, StreakTrend.Stable);
}
