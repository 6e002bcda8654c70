package io.conclave.bus;

import java.util.Objects;

/**
 * A durable queue bound to one exchange with a wildcard routing pattern.
 *
 * <p>Queues are created per consuming role and never shared across roles.
 *
 * @param queue    the queue name
 * @param exchange the exchange name
 * @param pattern  the topic binding pattern, e.g. {@code protocol.*}
 */
public record QueueBinding(String queue, String exchange, String pattern) {
    public QueueBinding {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(exchange, "exchange");
        Objects.requireNonNull(pattern, "pattern");
        if (queue.isEmpty()) {
            throw new IllegalArgumentException("queue cannot be empty");
        }
    }
}
