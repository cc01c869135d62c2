/**
 * Spring Boot integration: auto-configuration, {@code mailqueue.*} properties, the webhook
 * endpoint and Micrometer wiring.
 */
package mailqueue.spring.boot;
