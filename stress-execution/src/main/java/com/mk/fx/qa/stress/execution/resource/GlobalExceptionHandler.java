package com.mk.fx.qa.stress.execution.resource;

import com.mk.fx.qa.stress.execution.cfg.ErrorResponse;
import com.mk.fx.qa.stress.execution.exception.StressConflictException;
import com.mk.fx.qa.stress.execution.exception.StressSpawnException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    String details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    log.warn("Invalid request body: {}", details);
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Validation Failed", details);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    log.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
    return responseFactory.error(
        HttpStatus.BAD_REQUEST, "Malformed Request", "Request body is not valid JSON");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    String details = "Invalid value '" + ex.getValue() + "' for " + ex.getName();
    log.warn("Request parameter mismatch: {}", details);
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Argument", details);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
  }

  @ExceptionHandler(StressConflictException.class)
  public ResponseEntity<ErrorResponse> handleConflict(StressConflictException ex) {
    log.info("Conflict: {}", ex.getMessage());
    return responseFactory.conflict(ex.getMessage());
  }

  @ExceptionHandler(StressSpawnException.class)
  public ResponseEntity<ErrorResponse> handleSpawn(StressSpawnException ex) {
    log.error("Stress run {} failed to spawn", ex.getRunId(), ex);
    return responseFactory.error(HttpStatus.INTERNAL_SERVER_ERROR, "Spawn Error", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    // framework 4xx exceptions keep the status Spring assigned
    if (ex instanceof org.springframework.web.ErrorResponse springError) {
      HttpStatus status = HttpStatus.valueOf(springError.getStatusCode().value());
      log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
      return responseFactory.error(status, status.getReasonPhrase(), ex.getMessage());
    }
    log.error("Unhandled exception", ex);
    return responseFactory.error(HttpStatus.INTERNAL_SERVER_ERROR, "Server Error", ex.getMessage());
  }
}
