/**
 * JDBC persistence for the mail queue: job stores per database, repositories for the email
 * tables and the CRM address lookup.
 *
 * <p>DDL for H2, PostgreSQL and MySQL ships under {@code db/schema-*.sql} on the classpath.
 */
package mailqueue.jdbc;
