package com.gt.studyscheduler.util;

import java.time.Instant;
import java.util.UUID;

// Ids are "<prefix>_<epoch millis>_<9 random chars>" so they sort roughly by creation time and stay readable in logs.
public class StudyIdUtil {

    private static final String SESSION_PREFIX = "session";
    private static final String FLASHCARD_SET_PREFIX = "set";
    private static final int RANDOM_SUFFIX_LENGTH = 9;

    public static String newSessionId(Instant now) {
        return newId(SESSION_PREFIX, now);
    }

    public static String newFlashcardSetId(Instant now) {
        return newId(FLASHCARD_SET_PREFIX, now);
    }

    private static String newId(String prefix, Instant now) {
        String randomSuffix = UUID.randomUUID().toString().replace("-", "").substring(0, RANDOM_SUFFIX_LENGTH);
        return prefix + "_" + now.toEpochMilli() + "_" + randomSuffix;
    }
}
