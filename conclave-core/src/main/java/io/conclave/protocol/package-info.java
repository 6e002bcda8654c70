/**
 * Protocol rules shared by the agents.
 */
package io.conclave.protocol;
