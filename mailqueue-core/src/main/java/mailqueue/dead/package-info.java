/**
 * Dead-letter management for jobs that exhausted their attempts.
 */
package mailqueue.dead;
