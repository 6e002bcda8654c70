/**
 * Service provider interfaces: metrics export and the OS process primitives the supervisor
 * calls but does not implement itself.
 *
 * @see io.conclave.spi.BusMetrics
 * @see io.conclave.spi.ProcessLauncher
 * @see io.conclave.spi.ProcessSignaller
 * @see io.conclave.spi.LaunchCommandResolver
 */
package io.conclave.spi;
