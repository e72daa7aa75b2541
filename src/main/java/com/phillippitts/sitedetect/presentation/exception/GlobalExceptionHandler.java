package com.phillippitts.sitedetect.presentation.exception;

import com.phillippitts.sitedetect.exception.EngineCallException;
import com.phillippitts.sitedetect.exception.InvalidDetectionRequestException;
import com.phillippitts.sitedetect.exception.NoHealthyEngineException;
import com.phillippitts.sitedetect.exception.RequestNotFoundException;
import com.phillippitts.sitedetect.exception.UnknownCapabilityException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions at the REST boundary to {@link ApiError} bodies.
 *
 * <p>Engine endpoints and stack traces are logged, never returned.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(RequestNotFoundException.class)
    ResponseEntity<ApiError> handleNotFound(RequestNotFoundException ex) {
        LOG.debug("Status lookup miss: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Detection request not found", ex.getMessage());
    }

    @ExceptionHandler(InvalidDetectionRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidDetectionRequestException ex) {
        LOG.warn("Invalid detection request: {}", ex.getReason());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(),
                "Invalid detection request", ex.getReason());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + " " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationError", "Invalid detection request", details);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    ResponseEntity<ApiError> handleUnreadable(Exception ex) {
        LOG.warn("Unreadable request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Malformed request",
                "Request body or parameters could not be parsed");
    }

    /**
     * Configuration error: nothing was ever registered for the capability.
     */
    @ExceptionHandler(UnknownCapabilityException.class)
    ResponseEntity<ApiError> handleUnknownCapability(UnknownCapabilityException ex) {
        LOG.error("Unknown capability: {}", ex.getMessage());
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(),
                "Capability not available", ex.getMessage());
    }

    /**
     * Transient: retry possible.
     */
    @ExceptionHandler(NoHealthyEngineException.class)
    ResponseEntity<ApiError> handleNoHealthyEngine(NoHealthyEngineException ex) {
        LOG.warn("No healthy engine for {}", ex.getCapability());
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Detection engines temporarily unavailable", "Please retry in a few seconds");
    }

    @ExceptionHandler(EngineCallException.class)
    ResponseEntity<ApiError> handleEngineCall(EngineCallException ex) {
        LOG.error("Engine call failed: capability={}, endpoint={}", ex.getCapability(), ex.getEndpoint(), ex);
        return error(HttpStatus.SERVICE_UNAVAILABLE, ex.getClass().getSimpleName(),
                "Detection engines temporarily unavailable", "Please retry in a few seconds");
    }

    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
