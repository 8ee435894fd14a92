/**
 * Service provider interfaces for the external collaborators of the pipeline:
 * mailbox access ({@link mailsched.spi.MessageSource}), event extraction
 * ({@link mailsched.spi.EventExtractor}), durable schedule state
 * ({@link mailsched.spi.PersistenceGateway}) and observability
 * ({@link mailsched.spi.MetricsExporter}).
 */
package mailsched.spi;
