package org.iceforge.heimdall.execution;

/**
 * The submitted payload cannot be executed as written. Terminal for the attempt.
 */
public class SubmissionValidationException extends RuntimeException {
    public SubmissionValidationException(String message) {
        super(message);
    }
}
