package com.astrolitetech.directory.schema;

import com.astrolitetech.directory.exception.DirectoryException;
import javax.sql.DataSource;
import lombok.extern.slf4j.Slf4j;
import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;

/** Brings the employees table to its current shape before the application serves requests. */
@Slf4j
public class SchemaLifecycleManager {

  static final String BASELINE_VERSION = "0";

  private final DataSource dataSource;
  private final String historyTable;
  private final String[] locations;

  public SchemaLifecycleManager(DataSource dataSource, String historyTable, String... locations) {
    this.dataSource = dataSource;
    this.historyTable = historyTable;
    this.locations = locations;
  }

  public MigrateResult ensureSchema() {
    log.debug("Checking employees schema (history table {})", historyTable);
    try {
      MigrateResult result = flyway().migrate();
      if (result.migrationsExecuted == 0) {
        log.info("Employees schema up to date at version {}", result.targetSchemaVersion);
      } else {
        log.info(
            "Applied {} schema migration(s), employees schema now at version {}",
            result.migrationsExecuted,
            result.targetSchemaVersion);
      }
      return result;
    } catch (FlywayException e) {
      log.error("Error initializing database: {}", e.getMessage(), e);
      throw DirectoryException.schemaInit(e);
    }
  }

  Flyway flyway() {
    return Flyway.configure()
        .dataSource(dataSource)
        .locations(locations)
        .table(historyTable)
        .baselineOnMigrate(true)
        .baselineVersion(BASELINE_VERSION)
        .load();
  }
}
