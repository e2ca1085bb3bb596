package com.example.barshift.exception;

/**
 * Raised when the generator detects a broken internal invariant. Never used for
 * scheduling constraints that cannot be met; those are reported as conflicts.
 */
public class ScheduleGenerationException extends RuntimeException {

    private final String errorCode;

    public ScheduleGenerationException(String message) {
        super(message);
        this.errorCode = "SCHEDULE_GENERATION_ERROR";
    }

    public String getErrorCode() {
        return errorCode;
    }
}
