/**
 * The durable job queue facade and its retry policy.
 *
 * @see mailqueue.queue.JobQueue
 */
package mailqueue.queue;
