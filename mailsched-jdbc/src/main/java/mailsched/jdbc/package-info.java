/**
 * JDBC persistence for the pipeline: connection provider, SQL helper with exception
 * translation, table naming and the student directory.
 *
 * <p>Reference DDL for each supported database ships as {@code schema/h2.sql},
 * {@code schema/postgresql.sql} and {@code schema/mysql.sql} on the classpath.
 */
package mailsched.jdbc;
