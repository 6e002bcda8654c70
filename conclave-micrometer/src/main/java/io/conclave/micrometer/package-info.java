/**
 * Micrometer bridge for bus metrics.
 *
 * @see io.conclave.micrometer.MicrometerBusMetrics
 */
package io.conclave.micrometer;
