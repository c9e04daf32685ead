package com.tinytasks.api.ops;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class StoreHealthRepository {

  private final JdbcTemplate jdbc;

  public StoreHealthRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  public void ping() {
    jdbc.queryForObject("select 1", Integer.class);
  }
}
