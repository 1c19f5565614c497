package com.gt.studyscheduler.review;

import com.gt.studyscheduler.model.CardMemoryState;
import com.gt.studyscheduler.model.MemorySnapshot;
import com.gt.studyscheduler.util.LimitUtil;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

@Component
public class DueSelector {

    public static final int DEFAULT_REVIEW_LIMIT = 20;
    public static final int DEFAULT_NEW_LIMIT = 5;

    private final Clock clock;

    @Autowired
    public DueSelector(Clock clock) {
        this.clock = clock;
    }

    /**
     * Cards whose next review date has passed, most overdue first. Cards overdue by the same amount are ordered by
     * ease factor so that harder cards come first.
     */
    public List<CardMemoryState> getCardsDueForReview(MemorySnapshot snapshot, int limit) {
        LimitUtil.requireNonNegative(limit, "limit");
        Instant now = clock.instant();

        return snapshot.states()
                .stream()
                .filter(state -> state.nextReviewDate() != null && !state.nextReviewDate().isAfter(now))
                .sorted(Comparator.comparing(CardMemoryState::nextReviewDate)     // earliest date == most overdue
                        .thenComparingDouble(CardMemoryState::easeFactor))
                .limit(limit)
                .toList();
    }

    // Items with no memory state yet, in the order the pool lists them
    public List<String> getNewCards(List<String> allItemIds, MemorySnapshot snapshot, int limit) {
        LimitUtil.requireNonNegative(limit, "limit");
        Set<String> studiedItemIds = snapshot.itemIds();

        return allItemIds.stream()
                .filter(itemId -> !studiedItemIds.contains(itemId))
                .limit(limit)
                .toList();
    }
}
