package mailsched.jdbc.store;

import mailsched.jdbc.JdbcTemplate;
import mailsched.jdbc.TableNames;

import java.sql.Connection;
import java.time.LocalDate;
import java.util.List;

/**
 * PostgreSQL persistence gateway.
 *
 * <p>Locks the pending classes behind booking counts with {@code FOR UPDATE}, so
 * concurrent processes allocating the same weeks serialize on those rows.
 */
public final class PostgresPersistenceGateway extends AbstractJdbcPersistenceGateway {

  public PostgresPersistenceGateway() {
    super();
  }

  public PostgresPersistenceGateway(String tablePrefix) {
    super(tablePrefix);
  }

  @Override
  public AbstractJdbcPersistenceGateway withTablePrefix(String tablePrefix) {
    return new PostgresPersistenceGateway(tablePrefix);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  protected void lockPendingClasses(Connection conn, LocalDate from, LocalDate toExclusive) {
    // FOR UPDATE is not allowed with GROUP BY, so lock in a separate statement
    String sql = "SELECT id FROM " + table(TableNames.RESCHEDULED_CLASS) +
        " WHERE status=" + PENDING + " AND class_date >= ? AND class_date < ? ORDER BY id FOR UPDATE";
    JdbcTemplate.query(conn, sql, rs -> rs.getLong(1), from, toExclusive);
  }
}
