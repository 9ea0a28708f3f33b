package com.responseready.apigateway.common.pipeline;

import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

/** Pings the database once; after the first success later calls are free. */
@Component
@Slf4j
public class JdbcPersistenceConnector implements PersistenceConnector {

  private final JdbcTemplate jdbcTemplate;
  private final AtomicBoolean connected = new AtomicBoolean();

  public JdbcPersistenceConnector(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public void ensureConnected() {
    if (connected.get()) {
      return;
    }
    jdbcTemplate.queryForObject("SELECT 1", Integer.class);
    if (connected.compareAndSet(false, true)) {
      log.info("Database connection established");
    }
  }
}
