/**
 * Service Provider Interfaces (SPI) for the mail queue.
 *
 * <p>These interfaces are the seams to persistence, the mail provider, OAuth, AI analysis and
 * metrics. JDBC, Graph, OpenAI and Micrometer implementations ship in their own modules.
 *
 * @see mailqueue.spi.JobStore
 * @see mailqueue.spi.MailProvider
 * @see mailqueue.spi.MetricsExporter
 */
package mailqueue.spi;
