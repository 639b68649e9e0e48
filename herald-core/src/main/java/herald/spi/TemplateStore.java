package herald.spi;

import herald.template.Template;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Persistence operations for the {@code notification_templates} table.
 *
 * @see herald.jdbc.store.JdbcTemplateStore
 */
public interface TemplateStore {

  /** Inserts a template whose timestamps are already set and returns it with its id. */
  Template insert(Connection conn, Template template) throws SQLException;

  Optional<Template> findByName(Connection conn, String name) throws SQLException;

  /** All templates ordered by name. */
  List<Template> findAll(Connection conn) throws SQLException;

  /** Updates the row matching {@code template.name()}; returns rows changed. */
  int update(Connection conn, Template template) throws SQLException;

  int delete(Connection conn, String name) throws SQLException;
}
