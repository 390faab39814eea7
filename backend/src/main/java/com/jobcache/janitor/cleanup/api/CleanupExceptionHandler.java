package com.jobcache.janitor.cleanup.api;

import com.jobcache.janitor.cleanup.service.ActiveSweepException;
import com.jobcache.janitor.cleanup.service.CacheSweepFailedException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CleanupExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(CleanupExceptionHandler.class);

  @ExceptionHandler(CacheSweepFailedException.class)
  public ResponseEntity<Map<String, String>> handleSweepFailed(CacheSweepFailedException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("message", messageOf(ex)));
  }

  @ExceptionHandler(ActiveSweepException.class)
  public ResponseEntity<Map<String, String>> handleActiveSweep(ActiveSweepException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("message", messageOf(ex)));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<Map<String, String>> handleUnexpected(RuntimeException ex) {
    log.error("Cleanup request failed unexpectedly", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("message", messageOf(ex)));
  }

  private static String messageOf(RuntimeException ex) {
    return ex.getMessage() == null ? "cleanup_failed" : ex.getMessage();
  }
}
