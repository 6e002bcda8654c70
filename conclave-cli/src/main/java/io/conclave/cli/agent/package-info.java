/**
 * Runtime loops of the five agents. Each agent is a separate JVM started by
 * {@code conclave agent <role>} and talks to the others only through its
 * {@link io.conclave.router.RoleRouter}.
 */
package io.conclave.cli.agent;
