/**
 * Repository goal: the two-tier goal file parser, its writer, and the keyword-overlap
 * alignment scorer that gates development requests against the goal.
 *
 * @see io.conclave.goal.GoalParser
 * @see io.conclave.goal.AlignmentScorer
 */
package io.conclave.goal;
