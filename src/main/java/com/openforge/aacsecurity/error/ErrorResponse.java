package com.openforge.aacsecurity.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.springframework.http.HttpStatus;

import java.time.Instant;
import java.util.List;

/**
 * Body of every non-2xx answer. {@code message} is always safe to show to the
 * caller; {@code fieldErrors} is present only for rejected request input.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        int              status,
        String           error,
        String           message,
        String           path,
        Instant          timestamp,
        List<FieldError> fieldErrors
) {

    public record FieldError(String field, String message) {
    }

    public static ErrorResponse of(HttpStatus status, String message, String path, Instant timestamp) {
        return new ErrorResponse(status.value(), status.getReasonPhrase(), message, path, timestamp, null);
    }

    public static ErrorResponse invalidInput(List<FieldError> fieldErrors, String path, Instant timestamp) {
        return new ErrorResponse(HttpStatus.BAD_REQUEST.value(), "Validation Failed",
                "Invalid request parameters", path, timestamp, List.copyOf(fieldErrors));
    }
}
