package io.conclave.router;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.Exchange;
import io.conclave.bus.MessageHandler;

import java.util.Map;

/**
 * Role-scoped view of the message bus.
 *
 * <p>Each router acts for exactly one {@link Role} and enforces the publish permission table:
 * the three privileged exchanges accept messages only from their designated role, while
 * activity and code-change events may come from any role, scoped under its own id. A publish
 * outside the role's permissions is logged and returns {@code false}; nothing reaches the bus.
 * This is a guard between cooperating processes, not an authorization boundary.
 *
 * <p>Obtain instances through {@link RoleRouters#forRole(Role, io.conclave.bus.MessageBus)},
 * which returns an {@link OfflineRoleRouter} when the bus is not connected.
 */
public interface RoleRouter extends AutoCloseable {

    Role role();

    /**
     * Publishes an event of {@code type} to {@code exchange} under this router's role.
     *
     * @param exchange the target exchange
     * @param type     the event type, last segment of the routing key
     * @param payload  the event payload
     * @return {@code true} if published (or logged, when offline)
     */
    boolean publish(Exchange exchange, String type, Map<String, Object> payload);

    default boolean sendActivity(String type, Map<String, Object> payload) {
        return publish(Exchange.AGENT_ACTIVITIES, type, payload);
    }

    default boolean sendCodeChange(String type, Map<String, Object> payload) {
        return publish(Exchange.CODE_CHANGES, type, payload);
    }

    default boolean sendProtocolUpdate(String type, Map<String, Object> payload) {
        return publish(Exchange.PROTOCOL_UPDATES, type, payload);
    }

    default boolean sendGovernanceReview(String type, Map<String, Object> payload) {
        return publish(Exchange.GOVERNANCE_REVIEWS, type, payload);
    }

    default boolean sendFeatureInsight(String type, Map<String, Object> payload) {
        return publish(Exchange.FEATURE_INSIGHTS, type, payload);
    }

    /**
     * Subscribes to protocol updates. Allowed for {@link Role#HUB} and {@link Role#FIXER}.
     *
     * @param handler the handler
     * @return {@code true} if subscribed
     */
    boolean listenForProtocolUpdates(MessageHandler handler);

    /**
     * Subscribes to governance reviews on the governor's default queue. Allowed for
     * {@link Role#GOVERNOR}.
     *
     * @param handler the handler
     * @return {@code true} if subscribed
     */
    boolean listenForGovernanceFeedback(MessageHandler handler);

    /**
     * Subscribes to the activity stream of one other role.
     *
     * @param source  the role whose activities are observed
     * @param handler the handler
     * @return {@code true} if subscribed
     */
    boolean listenForActivities(Role source, MessageHandler handler);

    /**
     * Subscribes the role's default queue.
     *
     * @param handler the handler
     * @return {@code true} if subscribed
     */
    boolean listenOnDefaultQueue(MessageHandler handler);

    boolean startConsuming(ConsumeMode mode);

    boolean isOnline();

    @Override
    void close();
}
