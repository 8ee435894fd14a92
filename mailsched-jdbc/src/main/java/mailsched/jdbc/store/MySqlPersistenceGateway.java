package mailsched.jdbc.store;

import mailsched.jdbc.JdbcTemplate;
import mailsched.jdbc.TableNames;

import java.sql.Connection;
import java.time.LocalDate;
import java.util.List;

/**
 * MySQL persistence gateway. Also handles TiDB and MariaDB URLs.
 *
 * <p>Locks the pending classes behind booking counts with {@code FOR UPDATE}.
 */
public final class MySqlPersistenceGateway extends AbstractJdbcPersistenceGateway {

  public MySqlPersistenceGateway() {
    super();
  }

  public MySqlPersistenceGateway(String tablePrefix) {
    super(tablePrefix);
  }

  @Override
  public AbstractJdbcPersistenceGateway withTablePrefix(String tablePrefix) {
    return new MySqlPersistenceGateway(tablePrefix);
  }

  @Override
  public String name() {
    return "mysql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:mysql:", "jdbc:tidb:", "jdbc:mariadb:");
  }

  @Override
  protected void lockPendingClasses(Connection conn, LocalDate from, LocalDate toExclusive) {
    String sql = "SELECT id FROM " + table(TableNames.RESCHEDULED_CLASS) +
        " WHERE status=" + PENDING + " AND class_date >= ? AND class_date < ? FOR UPDATE";
    JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), from, toExclusive);
  }
}
