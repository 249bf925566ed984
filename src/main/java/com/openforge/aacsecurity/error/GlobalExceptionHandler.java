package com.openforge.aacsecurity.error;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.MessageSourceResolvable;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Clock;
import java.util.List;

/**
 * Maps account-security failures and request errors onto {@link ErrorResponse}.
 *
 * Every {@link AccountSecurityException} already carries a caller-safe message
 * and its HTTP status; the precise reason was audited where it was raised.
 */
@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler {

    private final Clock clock;

    @ExceptionHandler(AccountSecurityException.class)
    public ResponseEntity<ErrorResponse> handleAccountSecurity(
            AccountSecurityException ex,
            HttpServletRequest request) {

        HttpStatus status = ex.getStatus();
        log.debug("[Error] {} -> {} on {}", ex.getClass().getSimpleName(), status.value(), request.getRequestURI());

        ResponseEntity.BodyBuilder response = ResponseEntity.status(status);
        if (status == HttpStatus.UNAUTHORIZED) {
            response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        }
        return response.body(ErrorResponse.of(status, ex.getMessage(), request.getRequestURI(), clock.instant()));
    }

    /** {@code @Valid} request bodies. */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(
            MethodArgumentNotValidException ex,
            HttpServletRequest request) {

        List<ErrorResponse.FieldError> fieldErrors = ex.getBindingResult()
                .getAllErrors()
                .stream()
                .map(error -> new ErrorResponse.FieldError(
                        error instanceof org.springframework.validation.FieldError fe ? fe.getField() : error.getObjectName(),
                        error.getDefaultMessage()))
                .toList();

        log.warn("[Error] {} invalid field(s) in body of {}", fieldErrors.size(), request.getRequestURI());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.invalidInput(fieldErrors, request.getRequestURI(), clock.instant()));
    }

    /** Constraint annotations on query parameters, e.g. paging bounds. */
    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleInvalidParameters(
            HandlerMethodValidationException ex,
            HttpServletRequest request) {

        List<ErrorResponse.FieldError> fieldErrors = ex.getAllValidationResults()
                .stream()
                .flatMap(result -> result.getResolvableErrors().stream()
                        .map(MessageSourceResolvable::getDefaultMessage)
                        .map(message -> new ErrorResponse.FieldError(
                                result.getMethodParameter().getParameterName(), message)))
                .toList();

        log.warn("[Error] {} invalid parameter(s) on {}", fieldErrors.size(), request.getRequestURI());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.invalidInput(fieldErrors, request.getRequestURI(), clock.instant()));
    }

    @ExceptionHandler({
            MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class,
            HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception ex, HttpServletRequest request) {
        log.warn("[Error] Malformed request on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(HttpStatus.BAD_REQUEST, "Malformed request",
                        request.getRequestURI(), clock.instant()));
    }

    /** Unknown role names and other rejected enum input. */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            IllegalArgumentException ex,
            HttpServletRequest request) {

        log.warn("[Error] Illegal argument on {}: {}", request.getRequestURI(), ex.getMessage());
        return ResponseEntity.badRequest()
                .body(ErrorResponse.of(HttpStatus.BAD_REQUEST, "Invalid request: " + ex.getMessage(),
                        request.getRequestURI(), clock.instant()));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ErrorResponse> handleOptimisticLock(
            OptimisticLockingFailureException ex,
            HttpServletRequest request) {

        log.warn("[Error] Concurrent update on {}", request.getRequestURI());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ErrorResponse.of(HttpStatus.CONFLICT,
                        "The account was modified by another request. Please retry.",
                        request.getRequestURI(), clock.instant()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(
            Exception ex,
            HttpServletRequest request) {

        log.error("[Error] Unhandled exception on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR,
                        "An unexpected error occurred", request.getRequestURI(), clock.instant()));
    }
}
