package com.gt.studyscheduler.exception;

public class DaoException extends RuntimeException {

    public DaoException(String errMsg)  {
        super(errMsg);
    }

    public DaoException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
