package com.astrolitetech.directory.service;

import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class HealthService {

  private final JdbcTemplate jdbcTemplate;

  /** Round trip to the store; throws the store's exception when it is unreachable. */
  public void ping() {
    jdbcTemplate.queryForObject("SELECT 1", Integer.class);
  }
}
