package mailsched.spring.boot;

import mailsched.Fingerprint;
import mailsched.Identity;
import mailsched.MailSchedulePipeline;
import mailsched.RawMessage;
import mailsched.extract.PromptedEventExtractor;
import mailsched.fetch.RunReport;
import mailsched.jdbc.DataSourceConnectionProvider;
import mailsched.jdbc.JdbcStudentDirectory;
import mailsched.jdbc.store.H2PersistenceGateway;
import mailsched.model.Notification;
import mailsched.model.NotificationType;
import mailsched.model.ScheduleEvent;
import mailsched.spi.CompletionClient;
import mailsched.spi.ConnectionProvider;
import mailsched.spi.EventExtractor;
import mailsched.spi.IdentityDirectory;
import mailsched.spi.MailboxConnection;
import mailsched.spi.MessageSource;
import mailsched.spi.NotificationListener;
import mailsched.spi.PersistenceGateway;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.sql.init.SqlInitializationAutoConfiguration;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

class MailScheduleAutoConfigurationTest {

  private static final Identity ALICE = Identity.of("alice");

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withConfiguration(AutoConfigurations.of(
          DataSourceAutoConfiguration.class,
          SqlInitializationAutoConfiguration.class,
          MailScheduleAutoConfiguration.class))
      .withPropertyValues(
          "spring.datasource.url=jdbc:h2:mem:mailsched_auto_test;DB_CLOSE_DELAY=-1",
          "spring.datasource.driver-class-name=org.h2.Driver",
          "spring.sql.init.mode=always",
          "spring.sql.init.schema-locations=classpath:schema/h2.sql",
          "mailsched.scheduler.enabled=false");

  @Test
  void createsPersistenceBeansWithoutMailbox() {
    runner.run(ctx -> {
      assertInstanceOf(DataSourceConnectionProvider.class, ctx.getBean(ConnectionProvider.class));
      assertInstanceOf(H2PersistenceGateway.class, ctx.getBean(PersistenceGateway.class));
      assertInstanceOf(JdbcStudentDirectory.class, ctx.getBean(IdentityDirectory.class));
      assertFalse(ctx.containsBean("mailSchedulePipeline"));
      assertFalse(ctx.containsBean("eventExtractor"));
    });
  }

  @Test
  void studentDirectoryReadsRoster() {
    runner.run(ctx -> {
      var directory = ctx.getBean(IdentityDirectory.class);
      assertTrue(directory.listIdentities().isEmpty());
    });
  }

  @Test
  void buildsPipelineAroundCompletionClient() {
    runner.withUserConfiguration(MailboxConfig.class, CompletionConfig.class).run(ctx -> {
      assertInstanceOf(PromptedEventExtractor.class, ctx.getBean(EventExtractor.class));
      var pipeline = ctx.getBean(MailSchedulePipeline.class);
      var notes = ctx.getBean(CollectingListener.class);

      RunReport report = pipeline.runOnce(List.of(ALICE));

      assertEquals(1, report.fetched());
      assertEquals(1, report.drives());
      assertEquals(1, notes.received.size());
      assertEquals(NotificationType.INTERVIEW, notes.received.get(0).type());
      assertEquals(1, ctx.getBean(Mailbox.class).markedRead.size());
    });
  }

  @Test
  void userExtractorTakesPrecedence() {
    runner.withUserConfiguration(MailboxConfig.class, CompletionConfig.class, ExtractorConfig.class)
        .run(ctx -> {
          assertFalse(ctx.containsBean("eventExtractor"));
          var extractor = ctx.getBean(EventExtractor.class);
          assertFalse(extractor instanceof PromptedEventExtractor);
          assertNotNull(ctx.getBean(MailSchedulePipeline.class));
        });
  }

  @Test
  void pipelineRequiresExtractor() {
    runner.withUserConfiguration(MailboxConfig.class).run(ctx -> {
      assertNotNull(ctx.getStartupFailure());
      assertInstanceOf(IllegalStateException.class, findRootCause(ctx.getStartupFailure()));
    });
  }

  @Test
  void backsOffWhenCustomGatewayPresent() {
    runner.withUserConfiguration(GatewayConfig.class).run(ctx -> {
      assertFalse(ctx.containsBean("persistenceGateway"));
      assertSame(ctx.getBean("customGateway"), ctx.getBean(PersistenceGateway.class));
    });
  }

  private static Throwable findRootCause(Throwable t) {
    Throwable cause = t;
    while (cause.getCause() != null) {
      cause = cause.getCause();
    }
    return cause;
  }

  static final class Mailbox implements MessageSource {
    final List<Fingerprint> markedRead = new CopyOnWriteArrayList<>();

    @Override
    public MailboxConnection connect(Identity identity) {
      List<RawMessage> unread = new ArrayList<>();
      unread.add(RawMessage.of(identity, "<drive-1@campus>", Instant.parse("2030-05-01T09:00:00Z"),
          "Acme interview on 20 May 2030 at 15:30"));
      return new MailboxConnection() {
        @Override
        public List<RawMessage> listUnread() {
          return unread;
        }

        @Override
        public void markRead(Collection<Fingerprint> fingerprints) {
          markedRead.addAll(fingerprints);
        }

        @Override
        public void close() {
        }
      };
    }
  }

  static final class CollectingListener implements NotificationListener {
    final List<Notification> received = new CopyOnWriteArrayList<>();

    @Override
    public void onNotification(Notification notification) {
      received.add(notification);
    }
  }

  @Configuration
  static class MailboxConfig {
    @Bean
    Mailbox mailbox() {
      return new Mailbox();
    }

    @Bean
    CollectingListener collectingListener() {
      return new CollectingListener();
    }
  }

  @Configuration
  static class CompletionConfig {
    @Bean
    CompletionClient completionClient() {
      return prompt -> "{\"type\": \"interview\", \"company_name\": \"Acme\","
          + " \"interview_datetime\": \"2030-05-20 15:30\", \"drive_stage\": \"Interview\"}";
    }
  }

  @Configuration
  static class ExtractorConfig {
    @Bean
    EventExtractor customExtractor() {
      return bodies -> bodies.stream().map(b -> (ScheduleEvent) ScheduleEvent.NONE).toList();
    }
  }

  @Configuration
  static class GatewayConfig {
    @Bean
    PersistenceGateway customGateway() {
      return new H2PersistenceGateway();
    }
  }
}
