package mailsched.jdbc;

import mailsched.spi.PersistenceConflictException;
import mailsched.spi.PersistenceUnavailableException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Lightweight JDBC helper to reduce boilerplate in persistence gateway implementations.
 *
 * <p>{@link SQLException}s are translated: unique-key violations become
 * {@link PersistenceConflictException}, connection failures become
 * {@link PersistenceUnavailableException}, everything else {@link ScheduleStoreException}.
 */
public final class JdbcTemplate {

  private static final String UNIQUE_VIOLATION = "23505";
  private static final String MYSQL_INTEGRITY_VIOLATION = "23000";
  private static final int MYSQL_DUPLICATE_ENTRY = 1062;
  private static final String CONNECTION_EXCEPTION_CLASS = "08";

  @FunctionalInterface
  public interface RowMapper<T> {
    T map(ResultSet rs) throws SQLException;
  }

  /** Execute INSERT/UPDATE, return rows affected. */
  public static int update(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      return ps.executeUpdate();
    } catch (SQLException e) {
      throw translate("Failed to execute update", e);
    }
  }

  /** Execute INSERT, return the generated key of the single inserted row. */
  public static long insert(Connection conn, String sql, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
      bindParams(ps, params);
      ps.executeUpdate();
      try (ResultSet keys = ps.getGeneratedKeys()) {
        if (keys.next()) {
          return keys.getLong(1);
        }
      }
      throw new ScheduleStoreException("Insert returned no generated key", null);
    } catch (SQLException e) {
      throw translate("Failed to execute insert", e);
    }
  }

  /** Execute SELECT, map rows. */
  public static <T> List<T> query(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    try (PreparedStatement ps = conn.prepareStatement(sql)) {
      bindParams(ps, params);
      try (ResultSet rs = ps.executeQuery()) {
        List<T> results = new ArrayList<>();
        while (rs.next()) {
          results.add(mapper.map(rs));
        }
        return results;
      }
    } catch (SQLException e) {
      throw translate("Failed to execute query", e);
    }
  }

  /** Execute SELECT, map the first row if any. */
  public static <T> Optional<T> queryOne(Connection conn, String sql, RowMapper<T> mapper, Object... params) {
    List<T> rows = query(conn, sql, mapper, params);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  static RuntimeException translate(String action, SQLException e) {
    String state = e.getSQLState();
    if (UNIQUE_VIOLATION.equals(state)
        || (MYSQL_INTEGRITY_VIOLATION.equals(state) && e.getErrorCode() == MYSQL_DUPLICATE_ENTRY)) {
      return new PersistenceConflictException(action + ": " + e.getMessage(), e);
    }
    if (state != null && state.startsWith(CONNECTION_EXCEPTION_CLASS)) {
      return new PersistenceUnavailableException(action + ": " + e.getMessage(), e);
    }
    return new ScheduleStoreException(action, e);
  }

  private static void bindParams(PreparedStatement ps, Object... params) throws SQLException {
    for (int i = 0; i < params.length; i++) {
      Object param = params[i];
      if (param == null) {
        ps.setObject(i + 1, null);
      } else if (param instanceof String s) {
        ps.setString(i + 1, s);
      } else if (param instanceof Integer n) {
        ps.setInt(i + 1, n);
      } else if (param instanceof Long n) {
        ps.setLong(i + 1, n);
      } else if (param instanceof Timestamp ts) {
        ps.setTimestamp(i + 1, ts);
      } else {
        ps.setObject(i + 1, param);
      }
    }
  }

  private JdbcTemplate() {}
}
