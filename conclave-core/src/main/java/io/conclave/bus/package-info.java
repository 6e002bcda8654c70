/**
 * Message bus abstraction: fixed exchanges and per-role queues, the JSON envelope, and the
 * consumption loop that feeds subscribed handlers.
 *
 * <p>Delivery is best-effort. A handler that throws drops its message without requeue, and
 * nothing published while disconnected is retried.
 *
 * @see io.conclave.bus.MessageBus
 * @see io.conclave.bus.ConsumptionLoop
 */
package io.conclave.bus;
