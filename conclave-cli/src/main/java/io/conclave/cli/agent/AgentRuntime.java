package io.conclave.cli.agent;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.MessageEnvelope;
import io.conclave.goal.RepositoryGoal;
import io.conclave.protocol.ProtocolRules;
import io.conclave.router.RoleRouter;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * Lifecycle shared by the five agents.
 *
 * <p>{@link #run()} loads the goal and rules, announces {@code startup}, registers the
 * role's listeners and runs its loop. {@link #close()} announces {@code shutdown} and closes
 * the router; it is idempotent and safe to call from a shutdown hook while {@code run()} is
 * still blocked. Agents without a broker keep running until closed.
 */
public abstract class AgentRuntime implements AutoCloseable {
    static final String PROTOCOL_RECEIVED = "protocol_received";

    protected final AgentContext context;
    protected final RoleRouter router;
    protected final Logger logger;

    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final CountDownLatch stopped = new CountDownLatch(1);
    private volatile RepositoryGoal goal;
    private volatile ProtocolRules rules = ProtocolRules.empty();

    protected AgentRuntime(AgentContext context) {
        this.context = context;
        this.router = context.router();
        this.logger = Logger.getLogger(AgentRuntime.class.getPackageName() + "." + context.role().id());
    }

    public Role role() {
        return context.role();
    }

    /**
     * Runs the agent until its loop ends or {@link #close()} is called.
     *
     * @return the process exit code
     */
    public final int run() {
        reloadGoal();
        reloadRules();
        logger.info(role().title() + " starting in " + context.workspace()
                + (router.isOnline() ? "" : " (offline)"));
        router.sendActivity("startup", startupDetails());
        try {
            registerListeners();
            loop();
            return 0;
        } finally {
            close();
        }
    }

    /** Subscribes the role's queues. Called once before {@link #loop()}. */
    protected abstract void registerListeners();

    /** Startup activity payload. */
    protected Map<String, Object> startupDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("repository", context.workspace().toString());
        details.put("protocols_loaded", rules.rules().size());
        return details;
    }

    /**
     * Blocks in consumption, then idles until closed. Consumption returns early when offline or
     * when the broker connection drops.
     */
    protected void loop() {
        router.startConsuming(ConsumeMode.BLOCKING);
        if (!isClosed()) {
            logger.info("Not consuming; idling until stopped");
        }
        awaitClose();
    }

    protected final void awaitClose() {
        try {
            stopped.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    protected final boolean isClosed() {
        return closed.get();
    }

    protected final RepositoryGoal goal() {
        return goal;
    }

    protected final ProtocolRules rules() {
        return rules;
    }

    protected final RepositoryGoal reloadGoal() {
        goal = context.goalFile().read();
        return goal;
    }

    protected final ProtocolRules reloadRules() {
        rules = context.rulesLoader().loadOrEmpty(context.workspace().rulesFile());
        return rules;
    }

    /**
     * Reloads the rules after a protocol update and acknowledges it.
     *
     * @param message the update
     * @return the update type
     */
    protected String applyProtocolUpdate(MessageEnvelope message) {
        String updateType = message.payloadString("type", "unknown");
        reloadRules();
        logger.info("Applied protocol update " + updateType + "; " + rules.rules().size() + " rules active");
        Map<String, Object> ack = new LinkedHashMap<>();
        ack.put("update_type", updateType);
        ack.put("acknowledged", true);
        ack.put("timestamp", Instant.now().toString());
        router.sendActivity(PROTOCOL_RECEIVED, ack);
        return updateType;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("reason", "stopped");
            details.put("timestamp", Instant.now().toString());
            router.sendActivity("shutdown", details);
            router.close();
        } finally {
            stopped.countDown();
            logger.info(role().title() + " stopped");
        }
    }
}
