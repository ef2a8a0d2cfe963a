package com.delta.prospector.company.api;

import com.delta.prospector.company.service.CompanyNotFoundException;
import com.delta.prospector.company.service.ExportConflictException;
import com.delta.prospector.company.service.InvalidAnalysisRequestException;
import com.delta.prospector.company.service.InvalidSearchFiltersException;
import com.delta.prospector.company.service.NoResumableExportException;
import com.delta.prospector.company.service.UpstreamException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

@RestControllerAdvice
public class ProspectorExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(ProspectorExceptionHandler.class);

  @ExceptionHandler(ExportConflictException.class)
  public ResponseEntity<Map<String, Object>> handleActiveExport(ExportConflictException ex) {
    Map<String, Object> body = errorBody(ex.getMessage(), "export_in_progress");
    body.put("active_run_id", ex.getActiveRunId());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(NoResumableExportException.class)
  public ResponseEntity<Map<String, Object>> handleNothingToResume(NoResumableExportException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT).body(errorBody(ex.getMessage(), "nothing_to_resume"));
  }

  @ExceptionHandler({InvalidSearchFiltersException.class, InvalidAnalysisRequestException.class})
  public ResponseEntity<Map<String, Object>> handleInvalidRequest(RuntimeException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(errorBody(ex.getMessage(), "invalid_request"));
  }

  @ExceptionHandler(CompanyNotFoundException.class)
  public ResponseEntity<Map<String, Object>> handleNotFound(CompanyNotFoundException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorBody(ex.getMessage(), "company_not_found"));
  }

  @ExceptionHandler(UpstreamException.class)
  public ResponseEntity<Map<String, Object>> handleUpstream(UpstreamException ex) {
    log.warn("Upstream failure ({}): {}", ex.getReasonCode(), ex.getMessage());
    return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(errorBody(ex.getMessage(), ex.getReasonCode()));
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<Map<String, Object>> handleStatus(ResponseStatusException ex) {
    String reason = ex.getStatusCode().is4xxClientError() ? "invalid_request" : "server_error";
    if (ex.getStatusCode().value() == HttpStatus.NOT_FOUND.value()) {
      reason = "not_found";
    }
    return ResponseEntity.status(ex.getStatusCode()).body(errorBody(ex.getReason(), reason));
  }

  private Map<String, Object> errorBody(String error, String reason) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("error", error == null ? "Request failed" : error);
    body.put("reason", reason);
    return body;
  }
}
