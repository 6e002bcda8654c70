/**
 * Supervision of the agent processes: launch, PID registry, status and two-phase stop.
 *
 * <p>{@link io.conclave.supervisor.ProcessSupervisor} depends only on the spawn and signal
 * primitives in {@link io.conclave.spi}; {@link io.conclave.supervisor.OsProcessLauncher} and
 * {@link io.conclave.supervisor.OsProcessSignaller} are the OS-backed implementations.
 */
package io.conclave.supervisor;
