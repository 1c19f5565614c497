package com.gt.studyscheduler.model;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.gt.studyscheduler.serialization.PracticeFrequencyDeserializer;
import com.gt.studyscheduler.serialization.PracticeFrequencySerializer;

@JsonSerialize(using = PracticeFrequencySerializer.class)
@JsonDeserialize(using = PracticeFrequencyDeserializer.class)
public enum PracticeFrequency {
    Daily("daily", 1),
    EveryTwoDays("every_2_days", 2),
    Weekly("weekly", 7),
    BiWeekly("bi_weekly", 14),
    Monthly("monthly", 0),          // calendar month, not a day count
    Custom("custom", 7);            // days come from the set, 7 when not given

    private final String wireName;
    private final int days;

    PracticeFrequency(String wireName, int days) {
        this.wireName = wireName;
        this.days = days;
    }

    public String getWireName() {
        return wireName;
    }

    public int getDays() {
        return days;
    }

    public static PracticeFrequency fromWireName(String wireName) {
        for (PracticeFrequency frequency : values()) {
            if (frequency.wireName.equals(wireName)) {
                return frequency;
            }
        }

        return null;
    }
}
