package com.task4ge.api.image;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public class JdbcImageRepository implements ImageRepository {

  private static final RowMapper<ImageRecord> ROW_MAPPER = (rs, rowNum) -> new ImageRecord(
      rs.getString("id"),
      rs.getString("hash"),
      rs.getString("storage_key"),
      rs.getString("url"),
      rs.getObject("created_at", OffsetDateTime.class),
      rs.getObject("updated_at", OffsetDateTime.class)
  );

  private final JdbcTemplate jdbc;

  public JdbcImageRepository(JdbcTemplate jdbc) {
    this.jdbc = jdbc;
  }

  @Override
  public void insert(ImageRecord image) {
    jdbc.update(
        """
        insert into image(id, hash, storage_key, url, created_at, updated_at)
        values (?,?,?,?,?,?)
        """,
        image.id(),
        image.hash(),
        image.storageKey(),
        image.url(),
        image.createdAt(),
        image.updatedAt()
    );
  }

  @Override
  public void delete(String id) {
    jdbc.update("delete from image where id = ?", id);
  }

  @Override
  public List<ImageRecord> findByIds(Collection<String> ids) {
    return findByColumn("id", ids);
  }

  @Override
  public List<ImageRecord> findByHashes(Collection<String> hashes) {
    return findByColumn("hash", hashes);
  }

  private List<ImageRecord> findByColumn(String column, Collection<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    String[] array = values.toArray(new String[0]);
    return jdbc.query(
        "select id, hash, storage_key, url, created_at, updated_at from image where " + column + " = any(?)",
        ps -> ps.setArray(1, ps.getConnection().createArrayOf("text", array)),
        ROW_MAPPER
    );
  }
}
