package com.gt.studyscheduler.review;

import com.gt.studyscheduler.memory.MemoryModel;
import com.gt.studyscheduler.model.*;
import com.gt.studyscheduler.util.LimitUtil;
import com.gt.studyscheduler.util.StudyIdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Random;

@Component
public class SessionComposer {

    private static final Logger log = LoggerFactory.getLogger(SessionComposer.class);

    static final int MATURE_INTERVAL_DAYS = 21;

    private final MemoryModel memoryModel;
    private final DueSelector dueSelector;
    private final Clock clock;
    private final Random random;

    @Autowired
    public SessionComposer(MemoryModel memoryModel, DueSelector dueSelector, Clock clock, Random random) {
        this.memoryModel = memoryModel;
        this.dueSelector = dueSelector;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Review cards are placed ahead of new cards before the list is cut to {@code maxCards}, so new cards are only
     * introduced when the due cards leave room for them. The shuffle only reorders the selected cards.
     */
    public StudySessionPlan createStudySession(List<String> allItemIds, MemorySnapshot snapshot, StudySessionOptions options) {
        LimitUtil.requireNonNegative(options.maxCards(), "maxCards");
        LimitUtil.requireNonNegative(options.newCardLimit(), "newCardLimit");
        LimitUtil.requireNonNegative(options.reviewCardLimit(), "reviewCardLimit");

        List<String> reviewCards = dueSelector.getCardsDueForReview(snapshot, options.reviewCardLimit())
                .stream()
                .map(CardMemoryState::itemId)
                .toList();

        List<String> newCards = options.includeNewCards()
                ? dueSelector.getNewCards(allItemIds, snapshot, options.newCardLimit())
                : List.of();

        List<String> sessionCards = new ArrayList<>(reviewCards);
        sessionCards.addAll(newCards);
        if (sessionCards.size() > options.maxCards()) {
            sessionCards = new ArrayList<>(sessionCards.subList(0, options.maxCards()));
        }

        shuffle(sessionCards);

        String sessionId = StudyIdUtil.newSessionId(clock.instant());
        log.info("Composed study session {} with {} cards ({} due for review, {} new available)",
                sessionId, sessionCards.size(), reviewCards.size(), newCards.size());

        return new StudySessionPlan(sessionId, sessionCards, newCards, reviewCards);
    }

    public MemorySnapshot processStudyResult(StudyResult result, MemorySnapshot snapshot) {
        Optional<CardMemoryState> existingState = snapshot.find(result.itemId());

        CardMemoryState currentState = existingState.orElseGet(() -> memoryModel.initializeCardMemory(result.itemId()));
        CardMemoryState updatedState = memoryModel.calculateNextReview(currentState, result.quality());

        return snapshot.withState(updatedState);
    }

    public StudyStats getStudyStats(MemorySnapshot snapshot) {
        List<CardMemoryState> states = snapshot.states();
        Instant todayEnd = LocalDate.now(clock).plusDays(1).atStartOfDay(clock.getZone()).toInstant();

        int dueToday = 0;
        int learning = 0;
        int mature = 0;
        double easeFactorSum = 0;
        long intervalSum = 0;
        int longestStreak = 0;

        for (CardMemoryState state : states) {
            if (state.nextReviewDate() != null && state.nextReviewDate().isBefore(todayEnd)) {
                dueToday++;
            }

            if (state.interval() < MATURE_INTERVAL_DAYS) {
                learning++;
            } else {
                mature++;
            }

            easeFactorSum += state.easeFactor();
            intervalSum += state.interval();
            longestStreak = Math.max(longestStreak, state.streak());
        }

        return new StudyStats(
                states.size(),
                dueToday,
                0,
                learning,
                mature,
                states.isEmpty() ? 0 : roundTo(easeFactorSum / states.size(), 100),
                states.isEmpty() ? 0 : roundTo((double) intervalSum / states.size(), 10),
                longestStreak);
    }

    private static double roundTo(double value, int scale) {
        return (double) Math.round(value * scale) / scale;
    }

    // Fisher-Yates
    private void shuffle(List<String> cards) {
        for (int i = cards.size() - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);

            String swap = cards.get(i);
            cards.set(i, cards.get(j));
            cards.set(j, swap);
        }
    }
}
