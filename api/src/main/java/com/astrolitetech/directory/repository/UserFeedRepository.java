package com.astrolitetech.directory.repository;

import com.astrolitetech.directory.model.UserView;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

/**
 * Reads accounts from the users table, which belongs to the registration subsystem. Calls go
 * through a circuit breaker; nothing is retried.
 */
@Slf4j
public class UserFeedRepository {

  public static final String CIRCUIT_NAME = "userFeedCircuit";

  private static final String CREATED_AFTER_SQL =
      "SELECT username, email, profile_image FROM users WHERE created_at > ?";

  private static final String CREATED_BETWEEN_SQL =
      "SELECT username, email, profile_image FROM users WHERE created_at > ? AND created_at <= ?";

  private static final String ALL_NEWEST_FIRST_SQL =
      "SELECT username, email, profile_image FROM users ORDER BY id DESC";

  private static final RowMapper<UserView> USER_VIEW_MAPPER =
      (rs, rowNum) ->
          new UserView(
              rs.getString("username"), rs.getString("email"), rs.getString("profile_image"));

  private final JdbcTemplate jdbcTemplate;
  private final CircuitBreaker circuitBreaker;

  public UserFeedRepository(JdbcTemplate jdbcTemplate, CircuitBreakerRegistry cbRegistry) {
    this.jdbcTemplate = jdbcTemplate;
    this.circuitBreaker = cbRegistry.circuitBreaker(CIRCUIT_NAME);
  }

  public List<UserView> findCreatedAfter(Instant after) {
    return guarded(
        () -> jdbcTemplate.query(CREATED_AFTER_SQL, USER_VIEW_MAPPER, Timestamp.from(after)));
  }

  /** Rows with {@code after < created_at <= upTo}. */
  public List<UserView> findCreatedBetween(Instant after, Instant upTo) {
    return guarded(
        () ->
            jdbcTemplate.query(
                CREATED_BETWEEN_SQL,
                USER_VIEW_MAPPER,
                Timestamp.from(after),
                Timestamp.from(upTo)));
  }

  public List<UserView> findAllNewestFirst() {
    return guarded(() -> jdbcTemplate.query(ALL_NEWEST_FIRST_SQL, USER_VIEW_MAPPER));
  }

  private <T> T guarded(Supplier<T> supplier) {
    return CircuitBreaker.decorateSupplier(circuitBreaker, supplier).get();
  }
}
