package com.sarkari.jobfeed.scrape.api;

import com.sarkari.jobfeed.scrape.error.InvalidSourceConfigException;
import com.sarkari.jobfeed.scrape.error.SourceNotFoundException;
import com.sarkari.jobfeed.scrape.error.SystemicScrapeException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class ScrapeExceptionHandler {

  @ExceptionHandler(SourceNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleMissingSource(SourceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "source_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(InvalidSourceConfigException.class)
  public ResponseEntity<Map<String, String>> handleInvalidConfig(InvalidSourceConfigException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of("error", "invalid_source_config", "message", ex.getMessage()));
  }

  @ExceptionHandler(SystemicScrapeException.class)
  public ResponseEntity<Map<String, String>> handleSystemic(SystemicScrapeException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "scrape_unavailable", "message", ex.getMessage()));
  }
}
