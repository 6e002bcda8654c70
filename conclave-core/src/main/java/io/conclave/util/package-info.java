/**
 * Internal utilities.
 */
package io.conclave.util;
