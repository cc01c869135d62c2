/**
 * Lifecycle of provider change-notification subscriptions.
 */
package mailqueue.subscription;
