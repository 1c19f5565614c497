package com.gt.studyscheduler.model;

public enum StreakTrend {
    Improving,
    Stable,
    Declining
}
