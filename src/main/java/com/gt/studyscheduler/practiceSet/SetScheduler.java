package com.gt.studyscheduler.practiceSet;

import com.gt.studyscheduler.model.FlashcardSetSchedule;
import com.gt.studyscheduler.model.PracticeFrequency;
import com.gt.studyscheduler.store.StudyStateDao;
import com.gt.studyscheduler.util.StudyIdUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-cadence practice reminders for whole flashcard sets. Runs independently of the per-card memory model.
 */
@Component
public class SetScheduler {

    private static final Logger log = LoggerFactory.getLogger(SetScheduler.class);

    static final int DEFAULT_PRACTICE_DAYS = 7;

    private final StudyStateDao studyStateDao;
    private final Clock clock;

    @Autowired
    public SetScheduler(StudyStateDao studyStateDao, Clock clock) {
        this.studyStateDao = studyStateDao;
        this.clock = clock;
    }

    /**
     * Monthly adds one calendar month; every other frequency adds a number of days. {@code customDays} is only
     * read for {@link PracticeFrequency#Custom}.
     */
    public Instant calculateNextPracticeDate(PracticeFrequency frequency, Integer customDays) {
        ZonedDateTime now = ZonedDateTime.now(clock);

        if (frequency == null) {
            return now.plusDays(DEFAULT_PRACTICE_DAYS).toInstant();
        }

        return switch (frequency) {
            case Monthly -> now.plusMonths(1).toInstant();
            case Custom -> now.plusDays(customDays == null || customDays == 0 ? DEFAULT_PRACTICE_DAYS : customDays).toInstant();
            default -> now.plusDays(frequency.getDays()).toInstant();
        };
    }

    public List<FlashcardSetSchedule> getFlashcardSetsDueForPractice() {
        return getFlashcardSetsDueForPractice(studyStateDao.loadFlashcardSets());
    }

    public List<FlashcardSetSchedule> getFlashcardSetsDueForPractice(List<FlashcardSetSchedule> flashcardSets) {
        Instant now = clock.instant();

        return flashcardSets.stream()
                .filter(set -> set.active() && set.nextPracticeDate() != null && !set.nextPracticeDate().isAfter(now))
                .toList();
    }

    public void updateFlashcardSetPracticeDate(String setId, Instant lastPracticed, Instant nextPracticeDate) {
        Optional<FlashcardSetSchedule> flashcardSet = getFlashcardSet(setId);

        if (flashcardSet.isEmpty()) {
            log.warn("Cannot update practice date, flashcard set {} does not exist", setId);
            return;
        }

        saveFlashcardSet(flashcardSet.get().withPracticeDates(lastPracticed, nextPracticeDate, clock.instant()));
    }

    public void recordSetPractice(String setId) {
        Optional<FlashcardSetSchedule> flashcardSet = getFlashcardSet(setId);

        if (flashcardSet.isEmpty()) {
            log.warn("Cannot record practice, flashcard set {} does not exist", setId);
            return;
        }

        Instant nextPracticeDate = calculateNextPracticeDate(flashcardSet.get().practiceFrequency(), flashcardSet.get().customFrequencyDays());
        log.info("Flashcard set {} practiced, next practice at {}", setId, nextPracticeDate);

        updateFlashcardSetPracticeDate(setId, clock.instant(), nextPracticeDate);
    }

    public boolean saveFlashcardSet(FlashcardSetSchedule flashcardSet) {
        List<FlashcardSetSchedule> flashcardSets = new ArrayList<>(studyStateDao.loadFlashcardSets());
        flashcardSets.removeIf(set -> flashcardSet.setId().equals(set.setId()));
        flashcardSets.add(flashcardSet);

        return studyStateDao.saveFlashcardSets(flashcardSets);
    }

    public List<FlashcardSetSchedule> getFlashcardSets() {
        return studyStateDao.loadFlashcardSets();
    }

    public Optional<FlashcardSetSchedule> getFlashcardSet(String setId) {
        return studyStateDao.loadFlashcardSets()
                .stream()
                .filter(set -> setId.equals(set.setId()))
                .findFirst();
    }

    public boolean deleteFlashcardSet(String setId) {
        List<FlashcardSetSchedule> flashcardSets = new ArrayList<>(studyStateDao.loadFlashcardSets());

        if (!flashcardSets.removeIf(set -> setId.equals(set.setId()))) {
            return true;
        }

        log.info("Deleting flashcard set {}", setId);
        return studyStateDao.saveFlashcardSets(flashcardSets);
    }

    public String generateFlashcardSetId() {
        return StudyIdUtil.newFlashcardSetId(clock.instant());
    }
}
