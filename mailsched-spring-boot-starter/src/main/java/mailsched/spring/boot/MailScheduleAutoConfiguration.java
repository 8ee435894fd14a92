package mailsched.spring.boot;

import mailsched.MailSchedulePipeline;
import mailsched.extract.JsonEventDecoder;
import mailsched.extract.PromptedEventExtractor;
import mailsched.jdbc.DataSourceConnectionProvider;
import mailsched.jdbc.JdbcStudentDirectory;
import mailsched.jdbc.store.AbstractJdbcPersistenceGateway;
import mailsched.jdbc.store.JdbcPersistenceGateways;
import mailsched.spi.CompletionClient;
import mailsched.spi.ConnectionProvider;
import mailsched.spi.EventExtractor;
import mailsched.spi.IdentityDirectory;
import mailsched.spi.MessageSource;
import mailsched.spi.MetricsExporter;
import mailsched.spi.NotificationListener;
import mailsched.spi.PersistenceGateway;

import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import javax.sql.DataSource;

/**
 * Auto-configuration for the reconciliation pipeline.
 *
 * <p>Persistence is wired from the application's {@link DataSource}: the gateway is
 * detected from the JDBC URL and the student roster is read from the {@code student}
 * table. The mailbox side is application specific, so the pipeline is only created once
 * a {@link MessageSource} bean exists. An {@link EventExtractor} bean is used as is;
 * otherwise one is built around a {@link CompletionClient} bean.
 *
 * <p>The pipeline bean is started on creation and closed with the context.
 *
 * @see MailScheduleProperties
 * @see MailScheduleMicrometerAutoConfiguration
 */
@AutoConfiguration(after = DataSourceAutoConfiguration.class)
@ConditionalOnClass(MailSchedulePipeline.class)
@ConditionalOnBean(DataSource.class)
@EnableConfigurationProperties(MailScheduleProperties.class)
public class MailScheduleAutoConfiguration {

  @Bean
  @ConditionalOnMissingBean(ConnectionProvider.class)
  public DataSourceConnectionProvider connectionProvider(DataSource dataSource) {
    return new DataSourceConnectionProvider(dataSource);
  }

  @Bean
  @ConditionalOnMissingBean(PersistenceGateway.class)
  public AbstractJdbcPersistenceGateway persistenceGateway(DataSource dataSource,
      MailScheduleProperties props) {
    AbstractJdbcPersistenceGateway detected = JdbcPersistenceGateways.detect(dataSource);
    String prefix = props.getTablePrefix();
    if (prefix != null && !prefix.isEmpty()) {
      return detected.withTablePrefix(prefix);
    }
    return detected;
  }

  @Bean
  @ConditionalOnMissingBean(IdentityDirectory.class)
  public JdbcStudentDirectory studentDirectory(ConnectionProvider connectionProvider,
      MailScheduleProperties props) {
    String prefix = props.getTablePrefix() == null ? "" : props.getTablePrefix();
    return new JdbcStudentDirectory(connectionProvider, prefix);
  }

  @Bean
  @ConditionalOnMissingBean(EventExtractor.class)
  @ConditionalOnBean(CompletionClient.class)
  public PromptedEventExtractor eventExtractor(CompletionClient completionClient,
      MailScheduleProperties props) {
    return new PromptedEventExtractor(completionClient, new JsonEventDecoder(),
        props.getExtraction().getMaxBodyChars());
  }

  @Bean(initMethod = "start", destroyMethod = "close")
  @ConditionalOnMissingBean
  @ConditionalOnBean(MessageSource.class)
  public MailSchedulePipeline mailSchedulePipeline(MailScheduleProperties props,
      ConnectionProvider connectionProvider,
      PersistenceGateway persistenceGateway,
      IdentityDirectory studentDirectory,
      MessageSource messageSource,
      ObjectProvider<EventExtractor> extractorProvider,
      ObjectProvider<MetricsExporter> metricsProvider,
      ObjectProvider<NotificationListener> listenerProvider) {

    EventExtractor extractor = extractorProvider.getIfAvailable();
    if (extractor == null) {
      throw new IllegalStateException(
          "An EventExtractor or CompletionClient bean is required for the mail schedule pipeline");
    }
    var builder = MailSchedulePipeline.builder()
        .connectionProvider(connectionProvider)
        .gateway(persistenceGateway)
        .messageSource(messageSource)
        .extractor(extractor)
        .directory(studentDirectory)
        .config(props.toPipelineConfig());
    MetricsExporter metrics = metricsProvider.getIfAvailable();
    if (metrics != null) {
      builder.metrics(metrics);
    }
    listenerProvider.orderedStream().forEach(builder::listener);
    return builder.build();
  }
}
