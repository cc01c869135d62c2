/**
 * Microsoft Graph adapters: the mail provider client and the OAuth refresh-token client.
 */
package mailqueue.graph;
