package com.sandy.aiot.pump.incidents.exception;

/**
 * Inbound payload is missing a field or carries a value that cannot be mapped. Caller error, not retried.
 */
public class ReportValidationException extends RuntimeException {
    public ReportValidationException(String message) {
        super(message);
    }
}
