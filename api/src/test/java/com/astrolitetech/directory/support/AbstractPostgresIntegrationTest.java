package com.astrolitetech.directory.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for store-backed tests. The container is started once for the whole
 * run so cached Spring contexts keep pointing at a live database. Subclasses carry
 * {@code @Testcontainers(disabledWithoutDocker = true)}.
 */
public abstract class AbstractPostgresIntegrationTest {

  protected static final PostgreSQLContainer<?> POSTGRES =
      new PostgreSQLContainer<>("postgres:16.4")
          .withDatabaseName("auth_db")
          .withUsername("directory_user")
          .withPassword("directory_password");

  protected static final String USERS_DDL =
      """
      CREATE TABLE IF NOT EXISTS users (
          id            SERIAL PRIMARY KEY,
          username      VARCHAR(50) NOT NULL,
          email         VARCHAR(100) NOT NULL,
          profile_image VARCHAR(255),
          created_at    TIMESTAMP NOT NULL DEFAULT CURRENT_TIMESTAMP
      )
      """;

  private static Path uploadDir;

  @DynamicPropertySource
  static void configureDatasource(DynamicPropertyRegistry registry) {
    startPostgres();
    registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
    registry.add("spring.datasource.username", POSTGRES::getUsername);
    registry.add("spring.datasource.password", POSTGRES::getPassword);
    registry.add("directory.uploads.dir", () -> uploadDir().toString());
  }

  protected static synchronized void startPostgres() {
    if (!POSTGRES.isRunning()) {
      POSTGRES.start();
    }
  }

  protected static synchronized Path uploadDir() {
    if (uploadDir == null) {
      try {
        uploadDir = Files.createTempDirectory("directory-uploads");
      } catch (IOException e) {
        throw new UncheckedIOException(e);
      }
    }
    return uploadDir;
  }
}
