package io.conclave.cli.agent;

import io.conclave.Role;
import io.conclave.bus.MessageEnvelope;

import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Protocol governor. Observes the hub and fixer activity streams and tallies activity types
 * per source role; logs governance reviews from the auditor.
 */
public final class GovernorAgent extends AgentRuntime {
    private final Map<String, AtomicInteger> activityCounts = new ConcurrentHashMap<>();

    public GovernorAgent(AgentContext context) {
        super(context);
    }

    @Override
    protected void registerListeners() {
        router.listenForGovernanceFeedback(this::onGovernanceReview);
        router.listenForActivities(Role.HUB, this::countActivity);
        router.listenForActivities(Role.FIXER, this::countActivity);
    }

    private void onGovernanceReview(MessageEnvelope message) {
        logger.info("Governance review " + message.routingKey() + " from " + message.sourceRole()
                + ": " + message.payload());
    }

    void countActivity(MessageEnvelope message) {
        String routingKey = message.routingKey();
        String type = routingKey.substring(routingKey.lastIndexOf('.') + 1);
        String key = message.sourceRole() + "." + type;
        int count = activityCounts.computeIfAbsent(key, k -> new AtomicInteger()).incrementAndGet();
        logger.fine("Observed " + key + " (" + count + ")");
    }

    /**
     * @return {@code <source role>.<activity type>} to number of observations, sorted by key
     */
    Map<String, Integer> activityCounts() {
        Map<String, Integer> snapshot = new TreeMap<>();
        activityCounts.forEach((key, count) -> snapshot.put(key, count.get()));
        return snapshot;
    }

    @Override
    public void close() {
        if (!isClosed()) {
            logger.info("Observed activity: " + activityCounts());
        }
        super.close();
    }
}
