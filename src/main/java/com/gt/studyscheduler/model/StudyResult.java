package com.gt.studyscheduler.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

// responseTime is in milliseconds and may be null
public record StudyResult(String itemId,
                          int quality,
                          Long responseTime,
                          Instant studiedAt) {

    @JsonIgnore
    public boolean isCorrect() {
        return quality >= QualityRating.CorrectHard.getValue();
    }
}
