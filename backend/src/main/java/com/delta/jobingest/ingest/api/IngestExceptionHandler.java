package com.delta.jobingest.ingest.api;

import com.delta.jobingest.ingest.service.ActivePipelinePassException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class IngestExceptionHandler {

  @ExceptionHandler(ActivePipelinePassException.class)
  public ResponseEntity<Map<String, String>> handleActivePass(ActivePipelinePassException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "active_pipeline_pass", "message", ex.getMessage()));
  }
}
