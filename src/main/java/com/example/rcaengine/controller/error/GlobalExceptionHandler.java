package com.example.rcaengine.controller.error;

import com.example.rcaengine.correlation.IncidentNotFoundException;
import com.example.rcaengine.lifecycle.IllegalStateTransitionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    private ApiError build(ErrorCode code, String msg, Map<String, Object> details) {
        return new ApiError(Instant.now(), code, msg, details);
    }

    @ExceptionHandler(IncidentNotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(IncidentNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(
                build(ErrorCode.INCIDENT_NOT_FOUND, ex.getMessage(), Map.of("incidentId", ex.getIncidentId()))
        );
    }

    @ExceptionHandler(IllegalStateTransitionException.class)
    public ResponseEntity<ApiError> handleTransition(IllegalStateTransitionException ex) {
        log.info("Rejected operation on {}: {}", ex.getIncidentId(), ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT).body(
                build(ErrorCode.ILLEGAL_TRANSITION, ex.getMessage(), Map.of("incidentId", ex.getIncidentId()))
        );
    }

    @ExceptionHandler({IllegalArgumentException.class, MissingServletRequestParameterException.class,
            MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ApiError> handleIllegalArg(Exception ex) {
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, ex.getMessage(), Map.of())
        );
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        Throwable cause = ex.getMostSpecificCause();
        return ResponseEntity.badRequest().body(
                build(ErrorCode.BAD_REQUEST, "Malformed request body: " + cause.getMessage(), Map.of())
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleAny(Exception ex) {
        log.error("Unhandled error: {}", ex.getMessage(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(
                build(ErrorCode.INTERNAL_ERROR, ex.getMessage(), Map.of())
        );
    }
}
