package com.tubedigest.feed.api;

import com.tubedigest.feed.service.ActiveCycleRunException;
import com.tubedigest.feed.service.CyclePersistenceException;
import com.tubedigest.feed.service.SourceNotFoundException;
import com.tubedigest.feed.youtube.ChannelResolutionException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class FeedExceptionHandler {

  @ExceptionHandler(ActiveCycleRunException.class)
  public ResponseEntity<Map<String, String>> handleActiveRun(ActiveCycleRunException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_cycle_run", "message", ex.getMessage()));
  }

  @ExceptionHandler(SourceNotFoundException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSource(SourceNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "source_not_found", "message", ex.getMessage()));
  }

  @ExceptionHandler(ChannelResolutionException.class)
  public ResponseEntity<Map<String, String>> handleUnresolvedChannel(ChannelResolutionException ex) {
    return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
        .body(Map.of(
            "error", "channel_unresolved",
            "reason", String.valueOf(ex.getReasonCode()),
            "message", ex.getMessage()));
  }

  @ExceptionHandler(CyclePersistenceException.class)
  public ResponseEntity<Map<String, String>> handlePersistence(CyclePersistenceException ex) {
    return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
        .body(Map.of("error", "persistence_failure", "message", String.valueOf(ex.getMessage())));
  }
}
