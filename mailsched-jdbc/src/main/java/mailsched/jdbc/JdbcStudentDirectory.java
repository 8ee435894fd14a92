package mailsched.jdbc;

import mailsched.Identity;
import mailsched.spi.ConnectionProvider;
import mailsched.spi.IdentityDirectory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;

/**
 * {@link IdentityDirectory} reading the {@code student} table. The credentials column
 * holds an opaque handle into an external secret store, never the secret itself.
 */
public final class JdbcStudentDirectory implements IdentityDirectory {
  private final ConnectionProvider connectionProvider;
  private final String table;

  public JdbcStudentDirectory(ConnectionProvider connectionProvider) {
    this(connectionProvider, "");
  }

  public JdbcStudentDirectory(ConnectionProvider connectionProvider, String tablePrefix) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.table = TableNames.prefixed(tablePrefix, TableNames.STUDENT);
  }

  @Override
  public List<Identity> listIdentities() {
    String sql = "SELECT student_id, credentials_handle FROM " + table + " ORDER BY student_id";
    Connection conn;
    try {
      conn = connectionProvider.getConnection();
    } catch (SQLException e) {
      throw JdbcTemplate.translate("Failed to obtain connection", e);
    }
    try (conn) {
      return JdbcTemplate.query(conn, sql,
          rs -> new Identity(rs.getString("student_id"), rs.getString("credentials_handle")));
    } catch (SQLException e) {
      throw JdbcTemplate.translate("Failed to close connection", e);
    }
  }
}
