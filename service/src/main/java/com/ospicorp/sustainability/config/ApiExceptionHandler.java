package com.ospicorp.sustainability.config;

import com.ospicorp.sustainability.actions.service.ActionService;
import com.ospicorp.sustainability.actions.service.ActionUpdateFailedException;
import com.ospicorp.sustainability.actions.service.ActionValidationException;
import com.ospicorp.sustainability.actions.store.ActionStorageException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Translates failures into HTTP responses. Field validation failures answer with a
 * {@code {"field": ["message", ...]}} map; everything else answers with a problem body whose
 * {@code detail} carries the message.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

  private static final Map<HttpStatus, String> TYPE_SLUGS = Map.of(
      HttpStatus.BAD_REQUEST, "bad-request",
      HttpStatus.NOT_FOUND, "not-found",
      HttpStatus.METHOD_NOT_ALLOWED, "method-not-allowed",
      HttpStatus.UNSUPPORTED_MEDIA_TYPE, "unsupported-media-type",
      HttpStatus.INTERNAL_SERVER_ERROR, "internal-error"
  );

  @ExceptionHandler(ActionValidationException.class)
  public ResponseEntity<Map<String, List<String>>> handleValidation(ActionValidationException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(ex.errors());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ProblemDetail> handleUnreadable(HttpMessageNotReadableException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request);
    return problem(HttpStatus.BAD_REQUEST, "JSON parse error", request);
  }

  @ExceptionHandler(ActionUpdateFailedException.class)
  public ResponseEntity<ProblemDetail> handleUpdateFailed(ActionUpdateFailedException ex,
      HttpServletRequest request) {
    logException(HttpStatus.BAD_REQUEST, ex, request,
        ex.getMessage() + " " + ex.actionId());
    return problem(HttpStatus.BAD_REQUEST, ex.getMessage(), request);
  }

  // Only digits reach the id routes, so a failed conversion is an id too large to exist.
  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ProblemDetail> handleTypeMismatch(MethodArgumentTypeMismatchException ex,
      HttpServletRequest request) {
    if ("id".equals(ex.getName())) {
      logException(HttpStatus.NOT_FOUND, ex, request, "Unknown action id " + ex.getValue());
      return problem(HttpStatus.NOT_FOUND, ActionService.NOT_FOUND, request);
    }
    logException(HttpStatus.BAD_REQUEST, ex, request);
    return problem(HttpStatus.BAD_REQUEST, "Invalid value for '" + ex.getName() + "'", request);
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ProblemDetail> handleBadRequest(IllegalArgumentException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.BAD_REQUEST, ex, request);
  }

  @ExceptionHandler(NoSuchElementException.class)
  public ResponseEntity<ProblemDetail> handleNotFound(NoSuchElementException ex,
      HttpServletRequest request) {
    return buildProblem(HttpStatus.NOT_FOUND, ex, request);
  }

  @ExceptionHandler({NoResourceFoundException.class, HttpRequestMethodNotSupportedException.class,
      HttpMediaTypeNotSupportedException.class})
  public ResponseEntity<ProblemDetail> handleFrameworkError(Exception ex,
      HttpServletRequest request) {
    HttpStatus status = HttpStatus.resolve(((ErrorResponse) ex).getStatusCode().value());
    if (status == null) {
      status = HttpStatus.BAD_REQUEST;
    }
    return buildProblem(status, ex, request);
  }

  @ExceptionHandler(ActionStorageException.class)
  public ResponseEntity<ProblemDetail> handleStorage(ActionStorageException ex,
      HttpServletRequest request) {
    logException(HttpStatus.INTERNAL_SERVER_ERROR, ex, request,
        ex.getMessage() + " at " + ex.location());
    return problem(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), request);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ProblemDetail> handleServerError(Exception ex, HttpServletRequest request) {
    return buildProblem(HttpStatus.INTERNAL_SERVER_ERROR, ex, request);
  }

  private ResponseEntity<ProblemDetail> buildProblem(HttpStatus status, Exception ex,
      HttpServletRequest request) {
    logException(status, ex, request);
    return problem(status, ex.getMessage(), request);
  }

  private ResponseEntity<ProblemDetail> problem(HttpStatus status, String message,
      HttpServletRequest request) {
    ProblemDetail detail = ProblemDetail.forStatusAndDetail(status, message);
    detail.setTitle(status.getReasonPhrase());
    detail.setInstance(URI.create(request.getRequestURI()));
    detail.setType(URI.create("https://docs.sustainability-actions.dev/problems/" +
        TYPE_SLUGS.getOrDefault(status, "internal-error")));
    detail.setProperty("path", request.getRequestURI());
    return ResponseEntity.status(status).body(detail);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request) {
    String errorMessage = ex.getMessage();
    if (errorMessage == null || errorMessage.isBlank()) {
      errorMessage = ex.getClass().getName();
    }
    logException(status, ex, request, errorMessage);
  }

  private void logException(HttpStatus status, Exception ex, HttpServletRequest request,
      String errorMessage) {
    String method = request.getMethod();
    String uriWithQuery = RequestDescriptions.uriWithQuery(request);
    String clientIp = RequestDescriptions.clientIp(request);

    if (status.is5xxServerError()) {
      log.error("Request {} {} from {} failed with status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage,
          ex);
    } else {
      log.warn("Request {} {} from {} returned status {}: {}",
          method,
          uriWithQuery,
          clientIp,
          status.value(),
          errorMessage);
    }
  }
}
