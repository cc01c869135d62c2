/**
 * Access-token lifecycle and token encryption at rest.
 */
package mailqueue.auth;
