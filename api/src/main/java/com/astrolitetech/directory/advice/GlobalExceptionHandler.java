package com.astrolitetech.directory.advice;

import com.astrolitetech.directory.exception.DirectoryException;
import com.astrolitetech.directory.exception.ErrorKind;
import com.astrolitetech.directory.model.ApiResponse;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.multipart.MaxUploadSizeExceededException;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  private final boolean exposeDetails;

  public GlobalExceptionHandler(
      @Value("${directory.errors.expose-details:true}") boolean exposeDetails) {
    this.exposeDetails = exposeDetails;
  }

  @ExceptionHandler(DirectoryException.class)
  public ResponseEntity<ApiResponse.Error> handleDirectory(DirectoryException ex) {
    ErrorKind kind = ex.getKind();
    if (kind.isClientError()) {
      log.warn("{}: {}", kind, ex.getMessage());
      return ResponseEntity.status(kind.getStatus()).body(ApiResponse.Error.of(kind.getMessage()));
    }
    log.error("{}: {}", kind, ex.getMessage(), ex);
    return serverError(kind, ex.getMessage());
  }

  @ExceptionHandler(DataAccessException.class)
  public ResponseEntity<ApiResponse.Error> handleStore(DataAccessException ex) {
    String details = ex.getMostSpecificCause().getMessage();
    log.error("Store error: {}", details, ex);
    return serverError(ErrorKind.STORE_ERROR, details);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ApiResponse.Error> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    log.warn("Upload rejected by the servlet container: {}", ex.getMessage());
    return ResponseEntity.status(ErrorKind.PAYLOAD_TOO_LARGE.getStatus())
        .body(ApiResponse.Error.of(ErrorKind.PAYLOAD_TOO_LARGE.getMessage()));
  }

  @ExceptionHandler(CallNotPermittedException.class)
  public ResponseEntity<ApiResponse.Error> handleServiceUnavailable(CallNotPermittedException ex) {
    log.error("Service unavailable: {}", ex.getMessage());
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(ApiResponse.Error.of("Service temporarily unavailable"));
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ApiResponse.Error> handleGeneric(Exception ex) {
    log.error("Unexpected error: {}", ex.getMessage(), ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(ApiResponse.Error.of("An unexpected error occurred"));
  }

  private ResponseEntity<ApiResponse.Error> serverError(ErrorKind kind, String details) {
    ApiResponse.Error body =
        exposeDetails
            ? ApiResponse.Error.withDetails(kind.getMessage(), details)
            : ApiResponse.Error.of(kind.getMessage());
    return ResponseEntity.status(kind.getStatus()).body(body);
  }
}
