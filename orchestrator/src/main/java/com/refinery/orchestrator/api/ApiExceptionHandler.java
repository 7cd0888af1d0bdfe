package com.refinery.orchestrator.api;

import com.refinery.orchestrator.api.dto.ErrorResponse;
import com.refinery.orchestrator.error.ErrorCode;
import com.refinery.orchestrator.error.InvalidTransitionException;
import com.refinery.orchestrator.error.RefineryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Clock;
import java.util.Map;

/**
 * Renders every error as {error, message, status, details, timestamp}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    private final Clock clock;

    public ApiExceptionHandler(Clock clock) {
        this.clock = clock;
    }

    @ExceptionHandler(RefineryException.class)
    public ResponseEntity<ErrorResponse> handleDomain(RefineryException e) {
        if (e instanceof InvalidTransitionException) {
            log.warn("Rejected transition: {}", e.getMessage());
        } else {
            log.debug("{}: {}", e.getCode(), e.getMessage());
        }
        return respond(e.getCode(), e.getMessage(), e.getDetails());
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return respond(ErrorCode.VALIDATION_ERROR,
                "Invalid value for '" + e.getName() + "': " + e.getValue(),
                Map.of("field", e.getName()));
    }

    @ExceptionHandler({MissingServletRequestParameterException.class, MissingRequestHeaderException.class})
    public ResponseEntity<ErrorResponse> handleMissing(Exception e) {
        return respond(ErrorCode.VALIDATION_ERROR, e.getMessage(), Map.of());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
        return respond(ErrorCode.VALIDATION_ERROR, "Malformed request body", Map.of());
    }

    // Framework errors that already know their status (unknown path, wrong method or content type).
    @ExceptionHandler({NoResourceFoundException.class,
                       HttpRequestMethodNotSupportedException.class,
                       HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleFramework(Exception e) {
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) e).getStatusCode();
        ErrorCode code = status.value() == 404 ? ErrorCode.NOT_FOUND : ErrorCode.VALIDATION_ERROR;
        return ResponseEntity.status(status)
                .body(new ErrorResponse(code.name(), e.getMessage(), status.value(), Map.of(), clock.instant()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e) {
        log.error("Unhandled error in request", e);
        return respond(ErrorCode.INTERNAL_ERROR, "Internal server error", Map.of());
    }

    private ResponseEntity<ErrorResponse> respond(ErrorCode code, String message, Map<String, Object> details) {
        return ResponseEntity.status(code.status())
                .body(new ErrorResponse(code.name(), message, code.status().value(), details, clock.instant()));
    }
}
