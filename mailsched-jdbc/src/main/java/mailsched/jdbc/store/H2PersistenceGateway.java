package mailsched.jdbc.store;

import java.util.List;

/**
 * H2 persistence gateway. Primarily for testing.
 *
 * <p>Booking counts are read without row locks.
 */
public final class H2PersistenceGateway extends AbstractJdbcPersistenceGateway {

  public H2PersistenceGateway() {
    super();
  }

  public H2PersistenceGateway(String tablePrefix) {
    super(tablePrefix);
  }

  @Override
  public AbstractJdbcPersistenceGateway withTablePrefix(String tablePrefix) {
    return new H2PersistenceGateway(tablePrefix);
  }

  @Override
  public String name() {
    return "h2";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:h2:");
  }
}
