/**
 * Inbound message processing: fetch, store, CRM linkage and AI classification.
 */
package mailqueue.processing;
