/**
 * Root API of the mail-to-schedule pipeline: turns per-student email into company drives,
 * rescheduled classes and notifications without duplicating or losing updates.
 *
 * <h2>Core Design</h2>
 * <p>A {@linkplain mailsched.fetch.BoundedFetchScheduler bounded fetch scheduler} pops
 * students from a {@linkplain mailsched.queue.IdentityPriorityQueue priority queue} ordered
 * by pending mail, lists their unread messages, skips fingerprints already held by the
 * {@linkplain mailsched.dedup.DeduplicationCache dedup cache}, extracts typed events in
 * batches and hands each event to the
 * {@linkplain mailsched.reconcile.ReconciliationEngine reconciliation engine}, which writes
 * one atomic unit of work per message. Natural keys in the store make replays harmless.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>mailsched-core</b>: model, SPIs, scheduler, engine (zero external deps)</li>
 *   <li><b>mailsched-jdbc</b>: JDBC persistence gateways (H2, MySQL, PostgreSQL)</li>
 *   <li><b>mailsched-micrometer</b>: Micrometer metrics exporter</li>
 *   <li><b>mailsched-spring-boot-starter</b>: Spring Boot auto-configuration</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var connProvider = new DataSourceConnectionProvider(dataSource);
 *
 * try (MailSchedulePipeline pipeline = MailSchedulePipeline.builder()
 *     .connectionProvider(connProvider)
 *     .gateway(JdbcPersistenceGateways.detect(dataSource))
 *     .messageSource(imapSource)
 *     .extractor(new PromptedEventExtractor(completionClient))
 *     .directory(new JdbcStudentDirectory(connProvider))
 *     .build()) {
 *   pipeline.start();
 * }
 * }</pre>
 */
package mailsched;
