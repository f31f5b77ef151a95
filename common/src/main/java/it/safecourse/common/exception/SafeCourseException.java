package it.safecourse.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base exception for all SafeCourse business exceptions.
 */
@Getter
public class SafeCourseException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    public SafeCourseException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    public SafeCourseException(String message, HttpStatus status, String errorCode, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }
}
