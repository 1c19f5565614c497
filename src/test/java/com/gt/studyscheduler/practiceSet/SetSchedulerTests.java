package com.gt.studyscheduler.practiceSet;

import com.gt.studyscheduler.model.FlashcardSetSchedule;
import com.gt.studyscheduler.model.PracticeFrequency;
import com.gt.studyscheduler.serialization.StudyStateCodec;
import com.gt.studyscheduler.store.StudyStateDao;
import com.gt.studyscheduler.util.InMemoryKeyValueStore;
import com.gt.studyscheduler.util.TestUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class SetSchedulerTests {

    private static final Instant TEST_NOW = Instant.parse("2026-01-31T10:00:00Z");

    private InMemoryKeyValueStore keyValueStore;
    private SetScheduler setScheduler;

    @BeforeEach
    public void setup() {
        keyValueStore = new InMemoryKeyValueStore();
        StudyStateDao studyStateDao = new StudyStateDao(keyValueStore, new StudyStateCodec(), "");

        setScheduler = new SetScheduler(studyStateDao, TestUtils.fixedClock(TEST_NOW));
    }

    @Test
    public void testCalculateNextPracticeDate() {
        assertEquals(TEST_NOW.plus(Duration.ofDays(1)), setScheduler.calculateNextPracticeDate(PracticeFrequency.Daily, null));
        assertEquals(TEST_NOW.plus(Duration.ofDays(2)), setScheduler.calculateNextPracticeDate(PracticeFrequency.EveryTwoDays, null));
        assertEquals(TEST_NOW.plus(Duration.ofDays(7)), setScheduler.calculateNextPracticeDate(PracticeFrequency.Weekly, null));
        assertEquals(TEST_NOW.plus(Duration.ofDays(14)), setScheduler.calculateNextPracticeDate(PracticeFrequency.BiWeekly, null));
        assertEquals(Instant.parse("2026-02-28T10:00:00Z"), setScheduler.calculateNextPracticeDate(PracticeFrequency.Monthly, null));
    }

    @Test
    public void testCalculateNextPracticeDate_Custom() {
        assertEquals(TEST_NOW.plus(Duration.ofDays(3)), setScheduler.calculateNextPracticeDate(PracticeFrequency.Custom, 3));
        assertEquals(TEST_NOW.plus(Duration.ofDays(7)), setScheduler.calculateNextPracticeDate(PracticeFrequency.Custom, null));
        assertEquals(TEST_NOW.plus(Duration.ofDays(7)), setScheduler.calculateNextPracticeDate(PracticeFrequency.Custom, 0));
    }

    @Test
    public void testCalculateNextPracticeDate_CustomDaysIgnoredForOtherFrequencies() {
        assertEquals(TEST_NOW.plus(Duration.ofDays(1)), setScheduler.calculateNextPracticeDate(PracticeFrequency.Daily, 30));
    }

    @Test
    public void testCalculateNextPracticeDate_NoFrequency() {
        assertEquals(TEST_NOW.plus(Duration.ofDays(7)), setScheduler.calculateNextPracticeDate(null, null));
    }

    @Test
    public void testGetFlashcardSetsDueForPractice() {
        FlashcardSetSchedule overdue = flashcardSet("set-overdue", TEST_NOW.minus(Duration.ofDays(2)), true);
        FlashcardSetSchedule dueNow = flashcardSet("set-due-now", TEST_NOW, true);
        FlashcardSetSchedule inactive = flashcardSet("set-inactive", TEST_NOW.minus(Duration.ofDays(2)), false);
        FlashcardSetSchedule future = flashcardSet("set-future", TEST_NOW.plus(Duration.ofHours(1)), true);
        FlashcardSetSchedule unscheduled = flashcardSet("set-unscheduled", null, true);

        setScheduler.saveFlashcardSet(overdue);
        setScheduler.saveFlashcardSet(dueNow);
        setScheduler.saveFlashcardSet(inactive);
        setScheduler.saveFlashcardSet(future);
        setScheduler.saveFlashcardSet(unscheduled);

        assertEquals(List.of(overdue, dueNow), setScheduler.getFlashcardSetsDueForPractice());
    }

    @Test
    public void testSaveFlashcardSet_ReplacesExisting() {
        setScheduler.saveFlashcardSet(flashcardSet("set-1", TEST_NOW, true));
        setScheduler.saveFlashcardSet(flashcardSet("set-2", TEST_NOW, true));

        FlashcardSetSchedule updated = flashcardSet("set-1", TEST_NOW.plus(Duration.ofDays(3)), false);
        assertTrue(setScheduler.saveFlashcardSet(updated));

        List<FlashcardSetSchedule> flashcardSets = setScheduler.getFlashcardSets();
        assertEquals(2, flashcardSets.size());
        assertEquals(updated, setScheduler.getFlashcardSet("set-1").orElseThrow());
    }

    @Test
    public void testUpdateFlashcardSetPracticeDate_Idempotent() {
        setScheduler.saveFlashcardSet(flashcardSet("set-1", TEST_NOW, true));
        Instant nextPracticeDate = TEST_NOW.plus(Duration.ofDays(5));

        setScheduler.updateFlashcardSetPracticeDate("set-1", TEST_NOW, nextPracticeDate);
        Map<String, String> valuesAfterFirstUpdate = Map.copyOf(keyValueStore.getValues());

        setScheduler.updateFlashcardSetPracticeDate("set-1", TEST_NOW, nextPracticeDate);

        assertEquals(valuesAfterFirstUpdate, keyValueStore.getValues());

        FlashcardSetSchedule flashcardSet = setScheduler.getFlashcardSet("set-1").orElseThrow();
        assertEquals(TEST_NOW, flashcardSet.lastPracticed());
        assertEquals(nextPracticeDate, flashcardSet.nextPracticeDate());
        assertEquals(TEST_NOW, flashcardSet.updated());
    }

    @Test
    public void testUpdateFlashcardSetPracticeDate_UnknownSet() {
        setScheduler.saveFlashcardSet(flashcardSet("set-1", TEST_NOW, true));
        Map<String, String> valuesBefore = Map.copyOf(keyValueStore.getValues());

        setScheduler.updateFlashcardSetPracticeDate("set-unknown", TEST_NOW, TEST_NOW.plus(Duration.ofDays(1)));

        assertEquals(valuesBefore, keyValueStore.getValues());
        assertTrue(setScheduler.getFlashcardSet("set-unknown").isEmpty());
    }

    @Test
    public void testRecordSetPractice() {
        FlashcardSetSchedule flashcardSet = new FlashcardSetSchedule("set-1", PracticeFrequency.Monthly, null,
                TEST_NOW.minus(Duration.ofDays(1)), null, true, Instant.EPOCH, Instant.EPOCH);
        setScheduler.saveFlashcardSet(flashcardSet);

        setScheduler.recordSetPractice("set-1");

        FlashcardSetSchedule practicedSet = setScheduler.getFlashcardSet("set-1").orElseThrow();
        assertEquals(TEST_NOW, practicedSet.lastPracticed());
        assertEquals(Instant.parse("2026-02-28T10:00:00Z"), practicedSet.nextPracticeDate());
        assertEquals(Instant.EPOCH, practicedSet.created());
        assertEquals(List.of(), setScheduler.getFlashcardSetsDueForPractice());
    }

    @Test
    public void testDeleteFlashcardSet() {
        setScheduler.saveFlashcardSet(flashcardSet("set-1", TEST_NOW, true));
        setScheduler.saveFlashcardSet(flashcardSet("set-2", TEST_NOW, true));

        assertTrue(setScheduler.deleteFlashcardSet("set-1"));
        assertTrue(setScheduler.deleteFlashcardSet("set-unknown"));

        assertEquals(List.of("set-2"), setScheduler.getFlashcardSets().stream().map(FlashcardSetSchedule::setId).toList());
    }

    @Test
    public void testGenerateFlashcardSetId() {
        String setId = setScheduler.generateFlashcardSetId();

        assertTrue(setId.matches("set_" + TEST_NOW.toEpochMilli() + "_[0-9a-f]{9}"), setId);
    }

    private static FlashcardSetSchedule flashcardSet(String setId, Instant nextPracticeDate, boolean active) {
        return new FlashcardSetSchedule(setId, PracticeFrequency.Weekly, null, nextPracticeDate, null, active, Instant.EPOCH, Instant.EPOCH);
    }
}
