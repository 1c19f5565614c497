package com.gt.studyscheduler.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

public record StudySessionOptions(int maxCards,
                                  int newCardLimit,
                                  int reviewCardLimit,
                                  boolean includeNewCards) {

    public static final int DEFAULT_MAX_CARDS = 20;
    public static final int DEFAULT_NEW_CARD_LIMIT = 5;
    public static final int DEFAULT_REVIEW_CARD_LIMIT = 15;

    public static StudySessionOptions defaults() {
        return new StudySessionOptions(DEFAULT_MAX_CARDS, DEFAULT_NEW_CARD_LIMIT, DEFAULT_REVIEW_CARD_LIMIT, true);
    }

    // Options left out of a request keep their default
    @JsonCreator
    public static StudySessionOptions of(@JsonProperty("maxCards") Integer maxCards,
                                         @JsonProperty("newCardLimit") Integer newCardLimit,
                                         @JsonProperty("reviewCardLimit") Integer reviewCardLimit,
                                         @JsonProperty("includeNewCards") Boolean includeNewCards) {
        return new StudySessionOptions(
                maxCards == null ? DEFAULT_MAX_CARDS : maxCards,
                newCardLimit == null ? DEFAULT_NEW_CARD_LIMIT : newCardLimit,
                reviewCardLimit == null ? DEFAULT_REVIEW_CARD_LIMIT : reviewCardLimit,
                includeNewCards == null || includeNewCards);
    }
}
