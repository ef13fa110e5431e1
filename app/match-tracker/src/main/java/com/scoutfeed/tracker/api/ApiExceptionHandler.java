package com.scoutfeed.tracker.api;

import com.scoutfeed.tracker.service.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("TRACKER_VALIDATION_ERROR", "request validation failed"));
  }

  @ExceptionHandler({
    HttpMessageNotReadableException.class,
    MissingServletRequestParameterException.class
  })
  public ResponseEntity<ApiErrorResponse> handleBadRequest(Exception ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(new ApiErrorResponse("TRACKER_BAD_REQUEST", ex.getMessage()));
  }

  @ExceptionHandler({
    PlayerNotFoundException.class,
    AccountNotFoundException.class,
    SubscriptionNotFoundException.class
  })
  public ResponseEntity<ApiErrorResponse> handleNotFound(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(new ApiErrorResponse("TRACKER_NOT_FOUND", ex.getMessage()));
  }

  @ExceptionHandler(DuplicateRegistrationException.class)
  public ResponseEntity<ApiErrorResponse> handleDuplicate(DuplicateRegistrationException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(new ApiErrorResponse("TRACKER_CONFLICT", ex.getMessage()));
  }

  @ExceptionHandler({StoreUnavailableException.class, DataAccessException.class})
  public ResponseEntity<ApiErrorResponse> handleStoreUnavailable(RuntimeException ex) {
    logger.warn("admin request failed on store access", ex);
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(new ApiErrorResponse("TRACKER_STORE_UNAVAILABLE", "store unavailable"));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("admin request failed", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("TRACKER_INTERNAL_ERROR", ex.getMessage()));
  }
}
