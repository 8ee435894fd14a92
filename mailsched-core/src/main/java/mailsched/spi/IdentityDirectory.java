package mailsched.spi;

import mailsched.Identity;

import java.util.List;

/**
 * Source of the identities a scheduled run should process.
 *
 * @see mailsched.jdbc.JdbcStudentDirectory
 */
@FunctionalInterface
public interface IdentityDirectory {

  List<Identity> listIdentities();
}
