package com.gt.studyscheduler.model;

import java.time.Instant;

public record FlashcardSetSchedule(String setId,
                                   PracticeFrequency practiceFrequency,
                                   Integer customFrequencyDays,
                                   Instant nextPracticeDate,
                                   Instant lastPracticed,
                                   boolean active,
                                   Instant created,
                                   Instant updated) {

    public FlashcardSetSchedule withPracticeDates(Instant lastPracticed, Instant nextPracticeDate, Instant updated) {
        return new FlashcardSetSchedule(setId, practiceFrequency, customFrequencyDays, nextPracticeDate, lastPracticed, active, created, updated);
    }
}
