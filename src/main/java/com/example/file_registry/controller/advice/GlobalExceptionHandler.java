package com.example.file_registry.controller.advice;

import com.example.file_registry.exception.BackendUnavailableException;
import com.example.file_registry.exception.CapabilityMismatchException;
import com.example.file_registry.exception.ConfigurationException;
import com.example.file_registry.exception.DuplicatePathException;
import com.example.file_registry.exception.InvalidRequestArgumentException;
import com.example.file_registry.exception.PayloadTooLargeException;
import com.example.file_registry.exception.ResourceNotFoundException;
import com.example.file_registry.exception.SourceNotFoundException;
import com.example.file_registry.exception.UnknownBackendTypeException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@ControllerAdvice
public class GlobalExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<Object> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex, WebRequest request) {
    Map<String, Object> body = new HashMap<>();
    body.put("timestamp", System.currentTimeMillis());
    body.put("status", HttpStatus.BAD_REQUEST.value());

    List<String> errors =
        ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + ": " + fieldError.getDefaultMessage())
            .collect(Collectors.toList());
    body.put("errors", errors);
    body.put("message", "Validation failed");

    return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
  }

  @ExceptionHandler({ResourceNotFoundException.class, SourceNotFoundException.class})
  public ResponseEntity<Object> handleNotFound(RuntimeException ex, WebRequest request) {
    return buildErrorResponse(ex, HttpStatus.NOT_FOUND, request);
  }

  @ExceptionHandler(DuplicatePathException.class)
  public ResponseEntity<Object> handleDuplicatePath(DuplicatePathException ex, WebRequest request) {
    return buildErrorResponse(ex, HttpStatus.CONFLICT, request);
  }

  @ExceptionHandler(PayloadTooLargeException.class)
  public ResponseEntity<Object> handlePayloadTooLarge(
      PayloadTooLargeException ex, WebRequest request) {
    return buildErrorResponse(ex, HttpStatus.PAYLOAD_TOO_LARGE, request);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<Object> handleMaxUploadSizeExceeded(
      MaxUploadSizeExceededException ex, WebRequest request) {
    return buildErrorResponse(
        ex, "Upload exceeds the configured multipart limit", HttpStatus.PAYLOAD_TOO_LARGE, request);
  }

  @ExceptionHandler({
    InvalidRequestArgumentException.class,
    UnknownBackendTypeException.class,
    CapabilityMismatchException.class,
    ConfigurationException.class,
    MissingServletRequestParameterException.class,
    MissingServletRequestPartException.class,
    HttpMessageNotReadableException.class
  })
  public ResponseEntity<Object> handleBadRequest(Exception ex, WebRequest request) {
    return buildErrorResponse(ex, HttpStatus.BAD_REQUEST, request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<Object> handleIllegalArgumentException(
      IllegalArgumentException ex, WebRequest request) {
    return buildErrorResponse(ex, HttpStatus.BAD_REQUEST, request);
  }

  @ExceptionHandler(BackendUnavailableException.class)
  public ResponseEntity<Object> handleBackendUnavailable(
      BackendUnavailableException ex, WebRequest request) {
    log.warn("Backend unavailable: {}", ex.getMessage());
    return buildErrorResponse(ex, HttpStatus.SERVICE_UNAVAILABLE, request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<Object> handleAllOtherExceptions(Exception ex, WebRequest request) {
    // framework exceptions such as an unmapped path or method carry their own status
    if (ex instanceof ErrorResponse) {
      HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
      if (status != null && status.is4xxClientError()) {
        return buildErrorResponse(ex, status, request);
      }
    }
    log.error("Unhandled error on {}", request.getDescription(false), ex);
    return buildErrorResponse(ex, ex.getMessage(), HttpStatus.INTERNAL_SERVER_ERROR, request);
  }

  private ResponseEntity<Object> buildErrorResponse(
      Exception ex, HttpStatus status, WebRequest request) {
    return buildErrorResponse(ex, ex.getMessage(), status, request);
  }

  private ResponseEntity<Object> buildErrorResponse(
      Exception ex, String message, HttpStatus status, WebRequest request) {
    Map<String, Object> body = new HashMap<>();
    body.put("timestamp", System.currentTimeMillis());
    body.put("status", status.value());
    body.put("error", status.getReasonPhrase());
    body.put("message", message);
    return new ResponseEntity<>(body, status);
  }
}
