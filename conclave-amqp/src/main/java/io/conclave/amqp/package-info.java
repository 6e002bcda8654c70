/**
 * RabbitMQ implementation of the conclave message bus.
 */
package io.conclave.amqp;
