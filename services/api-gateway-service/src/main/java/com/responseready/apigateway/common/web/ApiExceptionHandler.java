package com.responseready.apigateway.common.web;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Errors raised before a request reaches the pipeline: body binding and Bean Validation. Those
 * never touch rate-limit or lockout state.
 */
@RestControllerAdvice
@Slf4j
@RequiredArgsConstructor
public class ApiExceptionHandler {

  private final SafeErrorMessages safeErrorMessages;

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException e) {
    FieldError field = e.getBindingResult().getFieldError();
    String message =
        field != null && field.getDefaultMessage() != null
            ? field.getDefaultMessage()
            : "Invalid request";
    return ErrorResponse.entity(HttpStatus.BAD_REQUEST, message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e) {
    return ErrorResponse.entity(HttpStatus.BAD_REQUEST, "Invalid request body");
  }

  @ExceptionHandler(ApiException.class)
  public ResponseEntity<ErrorResponse> handleApi(ApiException e) {
    return ErrorResponse.entity(e.getStatus(), e.getMessage());
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handle500(Exception e) {
    // framework errors such as 404 or 405 keep their status
    if (e instanceof org.springframework.web.ErrorResponse framework
        && !framework.getStatusCode().is5xxServerError()) {
      HttpStatus status = HttpStatus.valueOf(framework.getStatusCode().value());
      return ErrorResponse.entity(status, status.getReasonPhrase());
    }
    log.error("Unhandled exception", e);
    return ErrorResponse.entity(
        HttpStatus.INTERNAL_SERVER_ERROR,
        safeErrorMessages.forClient(e, "An error occurred. Please try again later."));
  }
}
