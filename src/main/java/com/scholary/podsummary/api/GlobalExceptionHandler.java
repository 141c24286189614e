package com.scholary.podsummary.api;

import com.scholary.podsummary.InvalidInputException;
import com.scholary.podsummary.job.DuplicateJobException;
import com.scholary.podsummary.job.JobNotFoundException;
import com.scholary.podsummary.stage.StageAdapterException;
import com.scholary.podsummary.storage.ArtifactNotFoundException;
import com.scholary.podsummary.storage.StorageException;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps domain exceptions to HTTP status codes and an {@link ErrorResponse} body. */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler({JobNotFoundException.class, ArtifactNotFoundException.class})
  public ResponseEntity<ErrorResponse> handleNotFound(RuntimeException ex) {
    LOGGER.debug("Not found: {}", ex.getMessage());
    return error(HttpStatus.NOT_FOUND, "not_found", ex.getMessage());
  }

  @ExceptionHandler(DuplicateJobException.class)
  public ResponseEntity<ErrorResponse> handleDuplicate(DuplicateJobException ex) {
    LOGGER.warn("Duplicate job: {}", ex.getMessage());
    return error(HttpStatus.CONFLICT, "duplicate_job", ex.getMessage());
  }

  @ExceptionHandler(InvalidInputException.class)
  public ResponseEntity<ErrorResponse> handleInvalidInput(InvalidInputException ex) {
    LOGGER.warn("Invalid input: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "invalid_input", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .collect(Collectors.joining(", "));
    LOGGER.warn("Validation failed: {}", message);
    return error(HttpStatus.BAD_REQUEST, "invalid_input", message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    LOGGER.warn("Unreadable request body: {}", ex.getMessage());
    return error(HttpStatus.BAD_REQUEST, "invalid_input", "Malformed request body.");
  }

  @ExceptionHandler(StageAdapterException.class)
  public ResponseEntity<ErrorResponse> handleStageAdapter(StageAdapterException ex) {
    LOGGER.error("Provider {} failed: {}", ex.getProvider(), ex.getMessage());
    return error(HttpStatus.BAD_GATEWAY, "provider_failure", ex.getMessage());
  }

  @ExceptionHandler(StorageException.class)
  public ResponseEntity<ErrorResponse> handleStorage(StorageException ex) {
    LOGGER.error("Storage failure: {}", ex.getMessage(), ex);
    return error(HttpStatus.INTERNAL_SERVER_ERROR, "storage_failure", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    // Spring MVC's own exceptions (missing parameter, unsupported media type, ...) carry a status
    if (ex instanceof org.springframework.web.ErrorResponse webError) {
      int status = webError.getStatusCode().value();
      LOGGER.warn("Request rejected with {}: {}", status, ex.getMessage());
      String error = status >= 500 ? "internal_error" : "bad_request";
      return ResponseEntity.status(status).body(new ErrorResponse(error, ex.getMessage()));
    }
    LOGGER.error("Unexpected error: {}", ex.getMessage(), ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred.");
  }

  private static ResponseEntity<ErrorResponse> error(
      HttpStatus status, String error, String message) {
    return ResponseEntity.status(status).body(new ErrorResponse(error, message));
  }
}
