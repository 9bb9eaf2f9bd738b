package dev.docsage.config;

import dev.docsage.search.RetrievalFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <p>Invalid requests map to HTTP 400; a retrieval that cannot be served even in degraded mode
 * maps to HTTP 503 with a user-facing message, the cause being logged server-side only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  /** Maps bean validation failures on request bodies to a 400 Bad Request Problem Detail. */
  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request body");
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  /**
   * Maps {@link RetrievalFailedException} to a 503 Service Unavailable Problem Detail.
   *
   * @param ex the per-request retrieval failure
   * @return a Problem Detail carrying the user-facing message
   */
  @ExceptionHandler(RetrievalFailedException.class)
  ProblemDetail handleRetrievalFailed(RetrievalFailedException ex) {
    log.error("Retrieval failed: {}", ex.getMessage(), ex);
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getUserMessage());
  }
}
