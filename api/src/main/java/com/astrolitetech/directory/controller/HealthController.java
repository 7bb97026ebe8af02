package com.astrolitetech.directory.controller;

import com.astrolitetech.directory.model.ApiResponse;
import com.astrolitetech.directory.service.HealthService;
import io.swagger.v3.oas.annotations.Operation;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api")
public class HealthController {

  private final HealthService healthService;

  @GetMapping("/health")
  @Operation(summary = "Check the database connection")
  public ResponseEntity<Object> health() {
    try {
      healthService.ping();
      return ResponseEntity.ok(new ApiResponse.Health("Database connection OK"));
    } catch (DataAccessException e) {
      log.error("Health check failed: {}", e.getMessage());
      return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
          .body(
              ApiResponse.Error.withDetails(
                  "Database connection failed", e.getMostSpecificCause().getMessage()));
    }
  }
}
