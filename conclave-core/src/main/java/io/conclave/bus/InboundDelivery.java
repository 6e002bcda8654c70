package io.conclave.bus;

import java.io.IOException;
import java.util.Objects;

/**
 * A raw delivery waiting in the buffer of a {@link ConsumptionLoop}.
 *
 * @param queue        the queue the message came from
 * @param body         the undecoded message body
 * @param handler      the handler subscribed to the queue
 * @param acknowledger settles the delivery with the broker
 */
public record InboundDelivery(String queue, byte[] body, MessageHandler handler, Acknowledger acknowledger) {
    public InboundDelivery {
        Objects.requireNonNull(queue, "queue");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(acknowledger, "acknowledger");
    }

    /**
     * Settles a delivery with the broker.
     */
    public interface Acknowledger {

        /**
         * Positively acknowledges the delivery.
         *
         * @throws IOException if the broker channel fails
         */
        void ack() throws IOException;

        /**
         * Negatively acknowledges the delivery without requeue, dropping it.
         *
         * @throws IOException if the broker channel fails
         */
        void reject() throws IOException;
    }
}
