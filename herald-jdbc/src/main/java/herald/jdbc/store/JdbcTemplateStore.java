package herald.jdbc.store;

import herald.jdbc.HeraldStoreException;
import herald.jdbc.JdbcTemplate;
import herald.jdbc.TableNames;
import herald.spi.TemplateStore;
import herald.template.Template;
import herald.util.JsonCodec;

import java.sql.Connection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link TemplateStore} over the {@code notification_templates} table.
 */
public final class JdbcTemplateStore implements TemplateStore {
  private static final String COLUMNS =
      "id, name, title, body, variables, description, created_at, updated_at";

  private final String tableName;
  private final JsonCodec jsonCodec;
  private final JdbcTemplate.RowMapper<Template> rowMapper;

  public JdbcTemplateStore() {
    this(TableNames.NOTIFICATION_TEMPLATES, JsonCodec.getDefault());
  }

  public JdbcTemplateStore(String tableName, JsonCodec jsonCodec) {
    this.tableName = TableNames.validate(tableName);
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
    this.rowMapper = rs -> {
      try {
        return new Template(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("title"),
            rs.getString("body"),
            this.jsonCodec.parseObject(rs.getString("variables")),
            rs.getString("description"),
            JdbcTemplate.instant(rs, "created_at"),
            JdbcTemplate.instant(rs, "updated_at"));
      } catch (IllegalArgumentException e) {
        throw new HeraldStoreException("Corrupt template row " + rs.getString("name"), e);
      }
    };
  }

  @Override
  public Template insert(Connection conn, Template template) {
    String sql = "INSERT INTO " + tableName +
        " (name, title, body, variables, description, created_at, updated_at) VALUES (?,?,?,?,?,?,?)";
    long id = JdbcTemplate.insert(conn, sql,
        template.name(), template.titleTemplate(), template.bodyTemplate(),
        jsonCodec.toJson(template.variables()), template.description(),
        template.createdAt(), template.updatedAt());
    return new Template(id, template.name(), template.titleTemplate(), template.bodyTemplate(),
        template.variables(), template.description(), template.createdAt(), template.updatedAt());
  }

  @Override
  public Optional<Template> findByName(Connection conn, String name) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " WHERE name=?", rowMapper, name);
  }

  @Override
  public List<Template> findAll(Connection conn) {
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + tableName + " ORDER BY name", rowMapper);
  }

  @Override
  public int update(Connection conn, Template template) {
    String sql = "UPDATE " + tableName +
        " SET title=?, body=?, variables=?, description=?, updated_at=? WHERE name=?";
    return JdbcTemplate.update(conn, sql,
        template.titleTemplate(), template.bodyTemplate(), jsonCodec.toJson(template.variables()),
        template.description(), template.updatedAt(), template.name());
  }

  @Override
  public int delete(Connection conn, String name) {
    return JdbcTemplate.update(conn, "DELETE FROM " + tableName + " WHERE name=?", name);
  }
}
