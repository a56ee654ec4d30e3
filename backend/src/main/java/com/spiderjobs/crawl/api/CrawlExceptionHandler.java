package com.spiderjobs.crawl.api;

import com.spiderjobs.crawl.service.CrawlAlreadyRunningException;
import com.spiderjobs.crawl.service.UnknownSiteException;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CrawlExceptionHandler {

  @ExceptionHandler(CrawlAlreadyRunningException.class)
  public ResponseEntity<Map<String, String>> handleAlreadyRunning(CrawlAlreadyRunningException ex) {
    return ResponseEntity.status(HttpStatus.CONFLICT)
        .body(Map.of("error", "crawl_already_running", "message", ex.getMessage()));
  }

  @ExceptionHandler(UnknownSiteException.class)
  public ResponseEntity<Map<String, String>> handleUnknownSite(UnknownSiteException ex) {
    return ResponseEntity.status(HttpStatus.NOT_FOUND)
        .body(Map.of("error", "unknown_site", "message", ex.getMessage()));
  }
}
