/**
 * Database-specific {@link mailqueue.spi.JobStore} implementations and their registry.
 *
 * @see mailqueue.jdbc.store.JdbcJobStores
 */
package mailqueue.jdbc.store;
