/**
 * JDBC repositories for mailbox connections, webhook subscriptions, processed and sent email,
 * and the CRM address directory.
 */
package mailqueue.jdbc.repository;
