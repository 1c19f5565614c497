package com.gt.studyscheduler.model;

// newCards is always 0: states only hold studied items. Use DueSelector.getNewCards against the item pool instead.
public record StudyStats(int totalCards,
                         int dueToday,
                         int newCards,
                         int learning,
                         int mature,
                         double averageEaseFactor,
                         double averageInterval,
                         int longestStreak) { }
