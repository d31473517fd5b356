package com.mk.fx.qa.device.load.resource;

import com.mk.fx.qa.device.load.cfg.ErrorResponse;
import com.mk.fx.qa.device.load.identity.ConfigurationException;
import com.mk.fx.qa.device.load.identity.WorkerCountMismatchException;
import com.mk.fx.qa.device.load.store.MetricStoreException;
import jakarta.validation.ConstraintViolationException;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final ApiResponseFactory responseFactory;

  @ExceptionHandler(WorkerCountMismatchException.class)
  public ResponseEntity<ErrorResponse> handleWorkerCountMismatch(WorkerCountMismatchException ex) {
    log.warn(
        "Run rejected: pool size {} vs {} workers", ex.getPoolSize(), ex.getExpectedWorkerCount());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Worker Count Mismatch", ex.getMessage());
  }

  @ExceptionHandler(ConfigurationException.class)
  public ResponseEntity<ErrorResponse> handleConfiguration(ConfigurationException ex) {
    log.warn("Invalid run configuration: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Configuration", ex.getMessage());
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    log.warn("Invalid argument: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Argument", ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex) {
    var details =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
    log.warn("Invalid request body: {}", details);
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Request", details);
  }

  @ExceptionHandler({
    ConstraintViolationException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class,
    HttpMessageNotReadableException.class,
    HandlerMethodValidationException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    log.warn("Bad request: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
  }

  @ExceptionHandler(IllegalStateException.class)
  public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException ex) {
    log.warn("Conflict: {}", ex.getMessage());
    return responseFactory.error(HttpStatus.CONFLICT, "Conflict", ex.getMessage());
  }

  @ExceptionHandler(MetricStoreException.class)
  public ResponseEntity<ErrorResponse> handleStore(MetricStoreException ex) {
    log.error("Metric store unavailable: {}", ex.getMessage(), ex);
    return responseFactory.error(HttpStatus.SERVICE_UNAVAILABLE, "Store Error", ex.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGeneric(Exception ex) {
    log.error("Unhandled exception", ex);
    return responseFactory.error(
        HttpStatus.INTERNAL_SERVER_ERROR, "Server Error", ex.getMessage());
  }
}
