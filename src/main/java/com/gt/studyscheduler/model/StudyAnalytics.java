package com.gt.studyscheduler.model;

// averageAccuracy is a whole percentage, totalStudyTime whole minutes
public record StudyAnalytics(int sessionsCount,
                             int totalCardsStudied,
                             long averageAccuracy,
                             long totalStudyTime,
                             int streakDays) {

    public static final StudyAnalytics EMPTY = new StudyAnalytics(0, 0, 0, 0, 0);
}
