/**
 * Conclave: coordination layer for five cooperating agent processes working on one project.
 *
 * <p>Agents communicate only through topic exchanges on a message broker. Each agent acts for
 * one {@link io.conclave.Role}, publishes through a {@link io.conclave.router.RoleRouter}, and
 * checks development requests against the project goal with an
 * {@link io.conclave.goal.AlignmentScorer}. A {@link io.conclave.supervisor.ProcessSupervisor}
 * starts and stops the agents.
 */
package io.conclave;
