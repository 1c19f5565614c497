package com.gt.studyscheduler.model;

import java.util.List;

public record StudySessionPlan(String sessionId,
                               List<String> sessionCards,
                               List<String> newCards,
                               List<String> reviewCards) {

    public StudySessionPlan {
        sessionCards = List.copyOf(sessionCards);
        newCards = List.copyOf(newCards);
        reviewCards = List.copyOf(reviewCards);
    }
}
