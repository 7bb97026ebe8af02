package com.astrolitetech.directory.config;

import com.astrolitetech.directory.feed.ChangeFeedTracker;
import com.astrolitetech.directory.feed.ChangeFeedWatermark;
import com.astrolitetech.directory.feed.FeedMode;
import com.astrolitetech.directory.repository.UserFeedRepository;
import com.astrolitetech.directory.schema.SchemaLifecycleManager;
import com.astrolitetech.directory.storage.MediaAttachmentHandler;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import javax.sql.DataSource;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;

@Configuration
public class DirectoryBeansConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean(initMethod = "ensureSchema")
  public SchemaLifecycleManager schemaLifecycleManager(
      DataSource dataSource,
      @Value("${directory.schema.history-table:employee_schema_history}") String historyTable,
      @Value("${directory.schema.locations:classpath:db/migration}") String[] locations) {
    return new SchemaLifecycleManager(dataSource, historyTable, locations);
  }

  @Bean
  public MediaAttachmentHandler mediaAttachmentHandler(
      @Value("${directory.uploads.dir:uploads}") String uploadDir,
      @Value("${directory.uploads.url-prefix:uploads}") String urlPrefix,
      @Value("${directory.uploads.max-bytes:5242880}") long maxBytes,
      Clock clock) {
    return new MediaAttachmentHandler(Path.of(uploadDir), urlPrefix, maxBytes, clock);
  }

  @Bean
  public ChangeFeedWatermark changeFeedWatermark(Clock clock) {
    return new ChangeFeedWatermark(Instant.now(clock));
  }

  @Bean
  public UserFeedRepository userFeedRepository(
      JdbcTemplate jdbcTemplate, CircuitBreakerRegistry cbRegistry) {
    return new UserFeedRepository(jdbcTemplate, cbRegistry);
  }

  @Bean
  public ChangeFeedTracker changeFeedTracker(
      UserFeedRepository userFeedRepository,
      ChangeFeedWatermark watermark,
      Clock clock,
      @Value("${directory.feed.mode:shared}") String mode) {
    return new ChangeFeedTracker(userFeedRepository, watermark, clock, FeedMode.from(mode));
  }

  @Bean
  public CircuitBreakerRegistry circuitBreakerRegistry() {
    CircuitBreakerConfig cbConfig =
        CircuitBreakerConfig.custom()
            .failureRateThreshold(50)
            .waitDurationInOpenState(Duration.ofSeconds(30))
            .permittedNumberOfCallsInHalfOpenState(2)
            .minimumNumberOfCalls(5)
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(10)
            .recordExceptions(DataAccessException.class)
            .build();

    return CircuitBreakerRegistry.of(cbConfig);
  }

  @Bean
  public GroupedOpenApi publicApi() {
    return GroupedOpenApi.builder().group("public").pathsToMatch("/api/**").build();
  }
}
