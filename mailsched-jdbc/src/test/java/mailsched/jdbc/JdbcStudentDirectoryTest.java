package mailsched.jdbc;

import mailsched.Identity;
import mailsched.spi.PersistenceUnavailableException;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcStudentDirectoryTest {

  @Test
  void listsStudentsInIdOrder() throws Exception {
    JdbcDataSource ds = JdbcTestSupport.h2DataSource("directory");
    JdbcTestSupport.applySchema(ds, "h2");
    JdbcTestSupport.insertStudent(ds, "s2", "vault:s2");
    JdbcTestSupport.insertStudent(ds, "s1", "vault:s1");

    List<Identity> identities = new JdbcStudentDirectory(new DataSourceConnectionProvider(ds)).listIdentities();

    assertEquals(List.of(new Identity("s1", "vault:s1"), new Identity("s2", "vault:s2")), identities);
  }

  @Test
  void emptyTableListsNobody() throws Exception {
    JdbcDataSource ds = JdbcTestSupport.h2DataSource("directory_empty");
    JdbcTestSupport.applySchema(ds, "h2");

    assertTrue(new JdbcStudentDirectory(new DataSourceConnectionProvider(ds)).listIdentities().isEmpty());
  }

  @Test
  void unreachableDatabaseIsUnavailable() {
    JdbcStudentDirectory directory = new JdbcStudentDirectory(() -> {
      throw new SQLException("connection refused", "08001");
    });

    assertThrows(PersistenceUnavailableException.class, directory::listIdentities);
  }

  @Test
  void missingTableIsStoreFailure() {
    JdbcDataSource ds = JdbcTestSupport.h2DataSource("directory_missing");

    JdbcStudentDirectory directory = new JdbcStudentDirectory(new DataSourceConnectionProvider(ds), "other_");

    assertThrows(ScheduleStoreException.class, directory::listIdentities);
  }

  @Test
  void invalidPrefixRejected() {
    assertThrows(IllegalArgumentException.class,
        () -> new JdbcStudentDirectory(() -> null, "drop table;"));
  }
}
