/**
 * Micrometer integration for kvloader metrics.
 *
 * @see kvloader.micrometer.MicrometerMetricsExporter
 */
package kvloader.micrometer;
