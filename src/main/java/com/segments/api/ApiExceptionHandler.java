package com.segments.api;

import com.segments.domain.exception.NotFoundException;
import com.segments.domain.exception.ReportingException;
import com.segments.domain.exception.SchemaException;
import com.segments.domain.exception.StoreException;
import com.segments.domain.exception.ValidationException;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps reporting failures to HTTP statuses.
 *
 * - ValidationException, bad parameters -> 400
 * - NotFoundException -> 404
 * - SchemaException, StoreException -> 500
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ApiError> handleValidation(ValidationException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, e);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException e) {
        log.debug("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler(SchemaException.class)
    public ResponseEntity<ApiError> handleSchema(SchemaException e) {
        log.error("Table '{}' is incompatible with the reporting schema: missing {}", e.getTable(), e.getField());
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<ApiError> handleStore(StoreException e) {
        // already logged with its cause by the store
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    @ExceptionHandler({
            ConstraintViolationException.class,
            HandlerMethodValidationException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class
    })
    public ResponseEntity<ApiError> handleBadParameter(Exception e) {
        log.warn("Invalid request parameter: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new ApiError("VALIDATION_ERROR", e.getMessage()));
    }

    private static ResponseEntity<ApiError> respond(HttpStatus status, ReportingException e) {
        return ResponseEntity.status(status).body(new ApiError(e.getKind(), e.getMessage()));
    }
}
