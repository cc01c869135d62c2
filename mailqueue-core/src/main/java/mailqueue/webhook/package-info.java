/**
 * Intake of provider change notifications.
 *
 * @see mailqueue.webhook.WebhookReceiver
 */
package mailqueue.webhook;
