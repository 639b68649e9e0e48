package herald.jdbc;

import herald.jdbc.store.JdbcQueueStores;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Installs the four Herald tables from the DDL shipped as
 * {@code herald/schema-<dialect>.sql}, where {@code <dialect>} is a queue store
 * {@linkplain herald.jdbc.store.AbstractJdbcQueueStore#name() name}.
 *
 * <p>Every statement is idempotent ({@code CREATE ... IF NOT EXISTS}), so installing twice is
 * harmless.
 */
public final class HeraldSchema {
  private static final Logger logger = Logger.getLogger(HeraldSchema.class.getName());

  private HeraldSchema() {}

  /** Detects the dialect from the data source and installs the schema. */
  public static void install(DataSource dataSource) {
    String dialect = JdbcQueueStores.detect(dataSource).name();
    try (Connection conn = dataSource.getConnection()) {
      install(conn, dialect);
    } catch (SQLException e) {
      throw new HeraldStoreException("Failed to install schema", e);
    }
  }

  public static void install(Connection conn, String dialect) {
    List<String> statements = statements(dialect);
    try (Statement st = conn.createStatement()) {
      for (String sql : statements) {
        st.execute(sql);
      }
    } catch (SQLException e) {
      throw new HeraldStoreException("Failed to install " + dialect + " schema", e);
    }
    logger.log(Level.INFO, "Installed Herald {0} schema ({1} statements)",
        new Object[]{dialect, statements.size()});
  }

  /** Statements of the DDL resource for {@code dialect}, in file order. */
  public static List<String> statements(String dialect) {
    String resource = "herald/schema-" + dialect + ".sql";
    try (InputStream in = HeraldSchema.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IllegalArgumentException("No schema for dialect: " + dialect);
      }
      String ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
      List<String> statements = new ArrayList<>();
      for (String part : ddl.split(";")) {
        if (!part.isBlank()) {
          statements.add(part.trim());
        }
      }
      return statements;
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to read " + resource, e);
    }
  }
}
