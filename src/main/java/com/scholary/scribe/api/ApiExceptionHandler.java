package com.scholary.scribe.api;

import com.scholary.scribe.job.JobNotFoundException;
import com.scholary.scribe.service.JobBusyException;
import com.scholary.scribe.service.JobStateException;
import jakarta.validation.ConstraintViolationException;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Converts pipeline exceptions to HTTP responses.
 *
 * <p>Busy and state refusals are conflicts (409), unknown recordings are 404 and malformed
 * requests are 400.
 */
@RestControllerAdvice
class ApiExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(JobBusyException.class)
  ResponseEntity<ApiError> handleBusy(JobBusyException ex) {
    return error(HttpStatus.CONFLICT, "JobBusy", ex.getMessage());
  }

  @ExceptionHandler(JobStateException.class)
  ResponseEntity<ApiError> handleState(JobStateException ex) {
    LOGGER.info("Refused request for {}: {}", ex.getRecordingId(), ex.getMessage());
    return error(HttpStatus.CONFLICT, "JobState", ex.getMessage());
  }

  @ExceptionHandler(JobNotFoundException.class)
  ResponseEntity<ApiError> handleNotFound(JobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "JobNotFound", ex.getMessage());
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    MethodArgumentNotValidException.class,
    HandlerMethodValidationException.class,
    ConstraintViolationException.class
  })
  ResponseEntity<ApiError> handleBadRequest(Exception ex) {
    return error(HttpStatus.BAD_REQUEST, "InvalidArgument", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  ResponseEntity<ApiError> handleUnexpected(Exception ex) {
    LOGGER.error("Unexpected error", ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalError", "An unexpected error occurred");
  }

  private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status).body(new ApiError(code, message, Instant.now()));
  }

  /** Error body returned to API clients. */
  record ApiError(String errorCode, String message, Instant timestamp) {}
}
