package com.delta.leadgen.leads.api;

import com.delta.leadgen.leads.generation.GeneratorNotConfiguredException;
import com.delta.leadgen.leads.retry.LeadGenerationException;
import com.delta.leadgen.leads.service.JobNotTerminalException;
import com.delta.leadgen.leads.service.LeadRequestValidationException;
import com.delta.leadgen.leads.store.LeadJobNotFoundException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LeadExceptionHandler {

  @ExceptionHandler(LeadRequestValidationException.class)
  public ResponseEntity<Map<String, String>> handleValidation(LeadRequestValidationException ex) {
    return error(HttpStatus.BAD_REQUEST, "validation_failed", ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<Map<String, String>> handleUnreadable(HttpMessageNotReadableException ex) {
    return error(HttpStatus.BAD_REQUEST, "validation_failed", "Request body is missing or malformed");
  }

  @ExceptionHandler(LeadJobNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleNotFound(LeadJobNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, "job_not_found", ex.getMessage());
  }

  @ExceptionHandler(JobNotTerminalException.class)
  public ResponseEntity<Map<String, String>> handleNotTerminal(JobNotTerminalException ex) {
    return error(HttpStatus.BAD_REQUEST, "job_not_completed", ex.getMessage());
  }

  @ExceptionHandler(GeneratorNotConfiguredException.class)
  public ResponseEntity<Map<String, String>> handleNotConfigured(GeneratorNotConfiguredException ex) {
    return error(HttpStatus.SERVICE_UNAVAILABLE, "generator_not_configured", ex.getMessage());
  }

  @ExceptionHandler(LeadGenerationException.class)
  public ResponseEntity<Map<String, String>> handleGenerationFailure(LeadGenerationException ex) {
    return error(HttpStatus.BAD_GATEWAY, "lead_generation_failed", ex.getMessage());
  }

  private ResponseEntity<Map<String, String>> error(HttpStatus status, String code, String message) {
    return ResponseEntity.status(status)
        .body(Map.of("error", code, "message", message == null ? code : message));
  }
}
