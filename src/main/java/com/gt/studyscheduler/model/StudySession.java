package com.gt.studyscheduler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.List;

public record StudySession(String sessionId,
                           Instant startTime,
                           Instant endTime,
                           List<String> cardsStudied,
                           List<StudyResult> results,
                           int totalCards,
                           int correctCards,
                           Double averageResponseTime,
                           Long sessionDuration) {

    public StudySession {
        cardsStudied = cardsStudied == null ? List.of() : List.copyOf(cardsStudied);
        results = results == null ? List.of() : List.copyOf(results);
    }

    @JsonIgnore
    public boolean isFinished() {
        return endTime != null;
    }
}
