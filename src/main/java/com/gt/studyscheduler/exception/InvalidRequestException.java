package com.gt.studyscheduler.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a caller supplies a value the scheduler cannot work with, such as a quality outside 0-5 or a negative limit
@ResponseStatus(value = HttpStatus.BAD_REQUEST)
public class InvalidRequestException extends IllegalArgumentException {

    public InvalidRequestException(String msg) {
        super(msg);
    }
}
