package com.gt.studyscheduler.model;

public enum QualityRating {
    Blackout(0, "Complete blackout - no memory"),
    Incorrect(1, "Incorrect, but correct answer remembered"),
    IncorrectEasy(2, "Incorrect, but correct answer seemed easy"),
    CorrectHard(3, "Correct with serious difficulty"),
    CorrectHesitant(4, "Correct after hesitation"),
    CorrectEasy(5, "Perfect response");

    public static final int MIN_QUALITY = 0;
    public static final int MAX_QUALITY = 5;

    private static final String UNKNOWN_DESCRIPTION = "Unknown rating";

    private final int value;
    private final String description;

    QualityRating(int value, String description) {
        this.value = value;
        this.description = description;
    }

    public int getValue() {
        return value;
    }

    public String getDescription() {
        return description;
    }

    public static QualityRating fromValue(int value) {
        for (QualityRating rating : values()) {
            if (rating.value == value) {
                return rating;
            }
        }

        return null;
    }

    public static String getQualityDescription(int value) {
        QualityRating rating = fromValue(value);
        return rating == null ? UNKNOWN_DESCRIPTION : rating.description;
    }
}
