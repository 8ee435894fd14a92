package mailsched.jdbc.store;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC persistence gateways with auto-detection support.
 *
 * <p>Gateways are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/mailsched.jdbc.store.AbstractJdbcPersistenceGateway}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcPersistenceGateway gateway = JdbcPersistenceGateways.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcPersistenceGateway gateway = JdbcPersistenceGateways.detect("jdbc:postgresql://localhost/school");
 *
 * // Get by name
 * AbstractJdbcPersistenceGateway gateway = JdbcPersistenceGateways.get("mysql");
 * }</pre>
 */
public final class JdbcPersistenceGateways {

  private static final List<AbstractJdbcPersistenceGateway> GATEWAYS;
  private static final Map<String, AbstractJdbcPersistenceGateway> BY_NAME = new ConcurrentHashMap<>();

  static {
    GATEWAYS = ServiceLoader.load(AbstractJdbcPersistenceGateway.class)
        .stream()
        .map(ServiceLoader.Provider::get)
        .toList();

    for (AbstractJdbcPersistenceGateway gateway : GATEWAYS) {
      BY_NAME.put(gateway.name().toLowerCase(Locale.ROOT), gateway);
    }
  }

  private JdbcPersistenceGateways() {
  }

  /**
   * Returns all registered gateways.
   */
  public static List<AbstractJdbcPersistenceGateway> all() {
    return GATEWAYS;
  }

  /**
   * Gets a gateway by name.
   *
   * @param name gateway name (case-insensitive)
   * @return the gateway
   * @throws IllegalArgumentException if no gateway found
   */
  public static AbstractJdbcPersistenceGateway get(String name) {
    AbstractJdbcPersistenceGateway gateway = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (gateway == null) {
      throw new IllegalArgumentException("Unknown persistence gateway: " + name +
          ". Available: " + BY_NAME.keySet());
    }
    return gateway;
  }

  /**
   * Auto-detects the gateway from a DataSource.
   *
   * @throws IllegalStateException if detection fails or no matching gateway
   */
  public static AbstractJdbcPersistenceGateway detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      String url = conn.getMetaData().getURL();
      return detect(url);
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect persistence gateway from DataSource", e);
    }
  }

  /**
   * Auto-detects the gateway from a JDBC URL.
   *
   * @throws IllegalArgumentException if no matching gateway found
   */
  public static AbstractJdbcPersistenceGateway detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isEmpty()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }

    String lower = jdbcUrl.toLowerCase(Locale.ROOT);
    for (AbstractJdbcPersistenceGateway gateway : GATEWAYS) {
      for (String prefix : gateway.jdbcUrlPrefixes()) {
        if (lower.startsWith(prefix.toLowerCase(Locale.ROOT))) {
          return gateway;
        }
      }
    }

    throw new IllegalArgumentException("No persistence gateway found for JDBC URL: " + jdbcUrl +
        ". Supported prefixes: " + allPrefixes());
  }

  private static List<String> allPrefixes() {
    return GATEWAYS.stream()
        .flatMap(g -> g.jdbcUrlPrefixes().stream())
        .toList();
  }
}
