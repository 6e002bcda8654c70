package io.conclave.bus;

/**
 * Callback invoked once per message delivered to a subscribed queue.
 *
 * <p>Handlers run sequentially on the consumption loop thread of their bus. Returning
 * normally acknowledges the message. Throwing negatively acknowledges it <b>without
 * requeue</b>: the message is dropped, never redelivered. Handlers must therefore tolerate
 * gaps in the stream they observe.
 */
@FunctionalInterface
public interface MessageHandler {

    /**
     * Handles one delivered message.
     *
     * @param message the decoded envelope
     * @throws Exception if handling fails; the message is dropped
     */
    void onMessage(MessageEnvelope message) throws Exception;
}
