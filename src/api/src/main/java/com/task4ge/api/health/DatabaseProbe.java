package com.task4ge.api.health;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;

@Component
public class DatabaseProbe {

  private final JdbcTemplate jdbc;

  public DatabaseProbe(DataSource dataSource, StatusProperties props) {
    this.jdbc = new JdbcTemplate(dataSource);
    this.jdbc.setQueryTimeout(props.dbTimeoutSeconds());
  }

  /**
   * @throws org.springframework.dao.DataAccessException when the database cannot be reached
   */
  public void ping() {
    jdbc.queryForObject("select 1", Integer.class);
  }
}
