package io.conclave.bus;

/**
 * Connection state of a {@link MessageBus}.
 */
public enum ConnectionState {
    /** A broker connection and channel are open. */
    CONNECTED,
    /** No usable broker connection; messaging calls return "not connected" results. */
    DISCONNECTED
}
