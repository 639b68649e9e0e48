/**
 * JDBC plumbing shared by the Herald stores: {@link herald.jdbc.DataSourceConnectionProvider},
 * the {@link herald.jdbc.JdbcTemplate} helper and {@link herald.jdbc.HeraldSchema}, which
 * installs the shipped DDL.
 *
 * @see herald.jdbc.store
 */
package herald.jdbc;
