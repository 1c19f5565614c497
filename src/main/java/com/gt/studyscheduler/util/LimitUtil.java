package com.gt.studyscheduler.util;

import com.gt.studyscheduler.exception.InvalidRequestException;

public class LimitUtil {

    public static int requireNonNegative(int value, String name) {
        if (value < 0) {
            throw new InvalidRequestException(name + " must not be negative, was " + value);
        }

        return value;
    }
}
