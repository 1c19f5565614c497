package com.gt.studyscheduler.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

// Thrown when a study session is changed after it has ended
@ResponseStatus(value = HttpStatus.CONFLICT)
public class SessionStateException extends IllegalStateException {

    public SessionStateException(String msg) {
        super(msg);
    }
}
