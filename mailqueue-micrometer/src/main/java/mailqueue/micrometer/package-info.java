/**
 * Micrometer bridge for exporting queue and webhook metrics.
 *
 * @see mailqueue.micrometer.MicrometerMetricsExporter
 */
package mailqueue.micrometer;
