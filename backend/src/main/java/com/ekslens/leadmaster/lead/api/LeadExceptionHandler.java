package com.ekslens.leadmaster.lead.api;

import com.ekslens.leadmaster.lead.persistence.LeadPersistenceException;
import com.ekslens.leadmaster.lead.service.ActiveLeadRunException;
import com.ekslens.leadmaster.lead.service.InvalidSearchRequestException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class LeadExceptionHandler {

  @ExceptionHandler(ActiveLeadRunException.class)
  public ResponseEntity<Map<String, Object>> handleActiveRun(ActiveLeadRunException ex) {
    Map<String, Object> body = new LinkedHashMap<>();
    body.put("accepted", false);
    body.put("reason", "job_already_running");
    body.put("message", ex.getMessage());
    return ResponseEntity.status(HttpStatus.CONFLICT).body(body);
  }

  @ExceptionHandler(InvalidSearchRequestException.class)
  public ResponseEntity<Map<String, String>> handleInvalidRequest(InvalidSearchRequestException ex) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST)
        .body(Map.of("error", "invalid_search_request", "message", ex.getMessage()));
  }

  @ExceptionHandler(LeadPersistenceException.class)
  public ResponseEntity<Map<String, String>> handlePersistence(LeadPersistenceException ex) {
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(Map.of("error", "lead_not_saved", "message", ex.getMessage()));
  }
}
