package it.safecourse.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when caller input cannot be processed at all.
 */
public class ValidationException extends SafeCourseException {

    public ValidationException(String field, String message) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "SC_ERR_400"
        );
    }

    public ValidationException(String field, String message, Throwable cause) {
        super(
            String.format("Validation failed for '%s': %s", field, message),
            HttpStatus.BAD_REQUEST,
            "SC_ERR_400",
            cause
        );
    }
}
