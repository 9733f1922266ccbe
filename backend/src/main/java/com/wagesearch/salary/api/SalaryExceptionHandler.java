package com.wagesearch.salary.api;

import com.wagesearch.salary.service.ActiveIngestionException;
import com.wagesearch.salary.service.IngestionFailedException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class SalaryExceptionHandler {

  @ExceptionHandler(ActiveIngestionException.class)
  public ResponseEntity<Map<String, String>> handleActiveIngestion(ActiveIngestionException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_ingestion", "message", ex.getMessage()));
  }

  @ExceptionHandler(IngestionFailedException.class)
  public ResponseEntity<Map<String, String>> handleIngestionFailed(IngestionFailedException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "ingestion_failed", "message", ex.getMessage()));
  }
}
