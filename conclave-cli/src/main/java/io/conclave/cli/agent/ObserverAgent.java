package io.conclave.cli.agent;

import io.conclave.bus.MessageEnvelope;

/**
 * Auditor and insights agents: consume their default queue and log what arrives.
 */
public final class ObserverAgent extends AgentRuntime {

    public ObserverAgent(AgentContext context) {
        super(context);
    }

    @Override
    protected void registerListeners() {
        router.listenOnDefaultQueue(this::onMessage);
    }

    private void onMessage(MessageEnvelope message) {
        logger.info("Received " + message.routingKey() + " from " + message.sourceRole());
    }
}
