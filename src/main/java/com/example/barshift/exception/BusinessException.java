package com.example.barshift.exception;

/**
 * A well-formed request the scheduler refuses to work on (duplicate roster ids and the like).
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
