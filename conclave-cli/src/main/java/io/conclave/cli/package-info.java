/**
 * The {@code conclave} command: workspace initialization, agent supervision and the
 * {@code agent} entry point the supervisor launches.
 */
package io.conclave.cli;
