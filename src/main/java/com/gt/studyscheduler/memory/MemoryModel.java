package com.gt.studyscheduler.memory;

import com.gt.studyscheduler.exception.InvalidRequestException;
import com.gt.studyscheduler.model.CardMemoryState;
import com.gt.studyscheduler.model.QualityRating;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Per-card memory state and the SM-2 style review update.
 *
 * The ease factor is adjusted on every review, successful or not, while the interval follows the repetition count
 * (1 day, 6 days, then interval * ease factor) and falls back to 1 day on a failed recall.
 */
@Component
public class MemoryModel {

    public static final double MIN_EASE_FACTOR = 1.3;
    public static final double MAX_EASE_FACTOR = 2.5;
    public static final double INITIAL_EASE_FACTOR = 2.5;
    public static final int INITIAL_INTERVAL = 1;
    public static final int MIN_INTERVAL = 1;
    public static final int MAX_INTERVAL = 365;

    static final int SECOND_REVIEW_INTERVAL = 6;

    private final Clock clock;

    @Autowired
    public MemoryModel(Clock clock) {
        this.clock = clock;
    }

    public CardMemoryState initializeCardMemory(String itemId) {
        Instant now = clock.instant();

        return new CardMemoryState(
                itemId,
                INITIAL_INTERVAL,
                INITIAL_EASE_FACTOR,
                0,
                plusDays(now, 1),
                now,
                0,
                0,
                0,
                now,
                now);
    }

    public CardMemoryState calculateNextReview(CardMemoryState currentState, int quality) {
        validateQuality(quality);

        int newInterval;
        int newRepetitions;
        int newStreak;

        if (quality >= QualityRating.CorrectHard.getValue()) {
            newStreak = currentState.streak() + 1;

            if (currentState.repetitions() == 0) {
                newInterval = 1;
            } else if (currentState.repetitions() == 1) {
                newInterval = SECOND_REVIEW_INTERVAL;
            } else {
                newInterval = (int) Math.round(currentState.interval() * currentState.easeFactor());
            }

            newRepetitions = currentState.repetitions() + 1;
        } else {
            newRepetitions = 0;
            newInterval = 1;
            newStreak = 0;
        }

        int qualityGap = QualityRating.MAX_QUALITY - quality;
        double newEaseFactor = currentState.easeFactor() + (0.1 - qualityGap * (0.08 + qualityGap * 0.02));

        newEaseFactor = clamp(newEaseFactor, MIN_EASE_FACTOR, MAX_EASE_FACTOR);
        newInterval = (int) clamp(newInterval, MIN_INTERVAL, MAX_INTERVAL);

        Instant now = clock.instant();
        int newTotalReviews = currentState.totalReviews() + 1;
        double newAverageQuality = (currentState.averageQuality() * currentState.totalReviews() + quality) / newTotalReviews;

        return new CardMemoryState(
                currentState.itemId(),
                newInterval,
                newEaseFactor,
                newRepetitions,
                plusDays(now, newInterval),
                now,
                newTotalReviews,
                newAverageQuality,
                newStreak,
                currentState.created(),
                now);
    }

    private Instant plusDays(Instant instant, int days) {
        return ZonedDateTime.ofInstant(instant, clock.getZone()).plusDays(days).toInstant();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static void validateQuality(int quality) {
        if (quality < QualityRating.MIN_QUALITY || quality > QualityRating.MAX_QUALITY) {
            throw new InvalidRequestException("Quality " + quality + " is outside of the range "
                    + QualityRating.MIN_QUALITY + "-" + QualityRating.MAX_QUALITY);
        }
    }
}
