/**
 * Dialect-specific {@link mailsched.spi.PersistenceGateway} implementations and their
 * {@link java.util.ServiceLoader} registry.
 */
package mailsched.jdbc.store;
