/**
 * Outbound mail: queueing, delivery and retry of failed sends.
 */
package mailqueue.sending;
