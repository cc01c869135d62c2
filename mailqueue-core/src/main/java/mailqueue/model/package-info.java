/**
 * Domain model for the mail queue: jobs and their typed payloads, mailbox connections, webhook
 * subscriptions, and the processed and sent email records.
 *
 * @see mailqueue.model.Job
 * @see mailqueue.model.JobPayload
 */
package mailqueue.model;
