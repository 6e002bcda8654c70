package io.conclave.cli.agent;

/**
 * Maps each role to its runtime.
 */
public final class AgentRuntimes {

    private AgentRuntimes() {
    }

    public static AgentRuntime create(AgentContext context) {
        switch (context.role()) {
            case HUB:
                return new HubAgent(context);
            case FIXER:
                return new FixerAgent(context);
            case GOVERNOR:
                return new GovernorAgent(context);
            case AUDITOR:
            case INSIGHTS:
                return new ObserverAgent(context);
            default:
                throw new IllegalArgumentException("Unknown role " + context.role());
        }
    }
}
