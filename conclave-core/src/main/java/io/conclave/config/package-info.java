/**
 * Communication config: broker address, credentials, exchanges, timeouts and per-agent
 * settings, read from {@code .conclave/communication/config.json}.
 */
package io.conclave.config;
