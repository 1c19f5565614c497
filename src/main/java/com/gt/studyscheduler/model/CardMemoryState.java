package com.gt.studyscheduler.model;

import java.time.Instant;

public record CardMemoryState(String itemId,
                              int interval,
                              double easeFactor,
                              int repetitions,
                              Instant nextReviewDate,
                              Instant lastReviewDate,
                              int totalReviews,
                              double averageQuality,
                              int streak,
                              Instant created,
                              Instant updated) { }
