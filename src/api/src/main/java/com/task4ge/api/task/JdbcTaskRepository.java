package com.task4ge.api.task;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcTaskRepository implements TaskRepository {

  private static final String COLUMNS =
      "id, owner, name, description, start_date, end_date, priority, completed, image_ids, created_at, updated_at";

  private static final RowMapper<TaskRecord> ROW_MAPPER = (rs, rowNum) -> TaskRecord.builder()
      .id(rs.getString("id"))
      .owner(rs.getString("owner"))
      .name(rs.getString("name"))
      .description(rs.getString("description"))
      .startDate(rs.getObject("start_date", OffsetDateTime.class))
      .endDate(rs.getObject("end_date", OffsetDateTime.class))
      .priority(Priority.valueOf(rs.getString("priority")))
      .completed(rs.getBoolean("completed"))
      .imageIds(readIds(rs))
      .createdAt(rs.getObject("created_at", OffsetDateTime.class))
      .updatedAt(rs.getObject("updated_at", OffsetDateTime.class))
      .build();

  private final JdbcTemplate jdbc;

  public JdbcTaskRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public void insert(TaskRecord task) {
    jdbc.update(con -> {
      PreparedStatement ps = con.prepareStatement(
          """
          insert into task(
            id, owner, name, description,
            start_date, end_date, priority, completed,
            image_ids, created_at, updated_at
          ) values (?,?,?,?,?,?,?,?,?,?,?)
          """
      );
      ps.setString(1, task.id());
      ps.setString(2, task.owner());
      ps.setString(3, task.name());
      ps.setString(4, task.description());
      ps.setObject(5, task.startDate());
      ps.setObject(6, task.endDate());
      ps.setString(7, task.priority().name());
      ps.setBoolean(8, task.completed());
      ps.setArray(9, con.createArrayOf("text", task.imageIds().toArray()));
      ps.setObject(10, task.createdAt());
      ps.setObject(11, task.updatedAt());
      return ps;
    });
  }

  @Override
  public void update(TaskRecord task) {
    jdbc.update(con -> {
      PreparedStatement ps = con.prepareStatement(
          """
          update task
             set name = ?,
                 description = ?,
                 start_date = ?,
                 end_date = ?,
                 priority = ?,
                 completed = ?,
                 image_ids = ?,
                 updated_at = ?
           where id = ?
             and owner = ?
          """
      );
      ps.setString(1, task.name());
      ps.setString(2, task.description());
      ps.setObject(3, task.startDate());
      ps.setObject(4, task.endDate());
      ps.setString(5, task.priority().name());
      ps.setBoolean(6, task.completed());
      ps.setArray(7, con.createArrayOf("text", task.imageIds().toArray()));
      ps.setObject(8, task.updatedAt());
      ps.setString(9, task.id());
      ps.setString(10, task.owner());
      return ps;
    });
  }

  @Override
  public void delete(String owner, String id) {
    jdbc.update("delete from task where id = ? and owner = ?", id, owner);
  }

  @Override
  public Optional<TaskRecord> findByOwnerAndId(String owner, String id) {
    List<TaskRecord> rows = jdbc.query(
        "select " + COLUMNS + " from task where owner = ? and id = ?",
        ROW_MAPPER,
        owner,
        id
    );
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  @Override
  public List<TaskRecord> findAllByOwner(String owner) {
    return jdbc.query(
        "select " + COLUMNS + " from task where owner = ? order by created_at desc, id desc",
        ROW_MAPPER,
        owner
    );
  }

  @Override
  public long countReferences(String imageId, String excludingTaskId) {
    Long count = jdbc.queryForObject(
        "select count(1) from task where ? = any(image_ids) and id <> ?",
        Long.class,
        imageId,
        excludingTaskId
    );
    return count == null ? 0L : count;
  }

  private static List<String> readIds(ResultSet rs) throws SQLException {
    Array array = rs.getArray("image_ids");
    List<String> ids = new ArrayList<>();
    if (array == null) {
      return ids;
    }
    for (Object id : (Object[]) array.getArray()) {
      ids.add(String.valueOf(id));
    }
    return ids;
  }
}
