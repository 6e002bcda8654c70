package io.conclave.cli.agent;

import io.conclave.Role;
import io.conclave.bus.ConsumeMode;
import io.conclave.bus.MessageEnvelope;
import io.conclave.goal.AlignmentResult;
import io.conclave.goal.RepositoryGoal;
import io.conclave.protocol.ProtocolRules;
import io.conclave.supervisor.PidRegistry;

import java.io.IOException;
import java.io.PrintStream;
import java.time.Instant;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.regex.Pattern;

/**
 * Human-interactive hub. Reads console commands and development requests, gates requests on
 * goal alignment and forwards them to the other agents as {@code user_prompt} activities.
 * {@code code-change} commands are published as code changes. Protocol updates and the other
 * agents' activities are consumed in the background.
 */
public final class HubAgent extends AgentRuntime {
    static final double WARN_CONFIDENCE = 0.7;
    static final double CONFIRM_CONFIDENCE = 0.5;
    static final String CODE_CHANGE = "code-change";
    private static final Pattern CHANGE_TYPE = Pattern.compile("[a-z0-9_]+");
    private static final String RULE = "-".repeat(60);

    private final PrintStream out;

    public HubAgent(AgentContext context) {
        super(context);
        this.out = context.out();
    }

    @Override
    protected Map<String, Object> startupDetails() {
        Map<String, Object> details = super.startupDetails();
        details.put("goal", goalText());
        return details;
    }

    @Override
    protected void registerListeners() {
        router.listenForProtocolUpdates(this::onProtocolUpdate);
        router.listenOnDefaultQueue(this::onActivity);
    }

    private void onActivity(MessageEnvelope message) {
        if (role().id().equals(message.sourceRole())) {
            return;
        }
        String routingKey = message.routingKey();
        if (Role.FIXER.id().equals(message.sourceRole()) && routingKey.endsWith("." + FixerAgent.ANALYSIS_COMPLETE)) {
            out.println();
            out.println("Fixer analysis: " + message.payload().get("focus_areas"));
            Object recommendations = message.payload().get("recommendations");
            if (recommendations instanceof List<?> list) {
                list.forEach(item -> out.println("   * " + item));
            }
            return;
        }
        logger.fine("Activity " + routingKey + " from " + message.sourceRole());
    }

    private void onProtocolUpdate(MessageEnvelope message) {
        String updateType = applyProtocolUpdate(message);
        out.println();
        out.println("PROTOCOL UPDATE: " + updateType);
        out.println("   " + message.payloadString("description", "Protocol updated"));
        String newRule = message.payloadString("new_rule", "");
        if (!newRule.isEmpty()) {
            out.println("   New rule: " + newRule);
        }
        out.println("   Applied to current session");
        out.println(RULE);
    }

    @Override
    protected void loop() {
        router.startConsuming(ConsumeMode.BACKGROUND);
        showWelcome();
        out.println();
        out.println("Ready for your input...");
        while (!isClosed()) {
            out.print("> ");
            out.flush();
            String line;
            try {
                line = context.in().readLine();
            } catch (IOException e) {
                logger.log(Level.WARNING, "Console read failed", e);
                line = null;
            }
            if (line == null) {
                logger.info("Console closed; serving the bus until stopped");
                awaitClose();
                return;
            }
            if (!handle(line)) {
                return;
            }
        }
    }

    /**
     * Processes one console line.
     *
     * @param rawInput the line
     * @return {@code false} when the user asked to exit
     */
    boolean handle(String rawInput) {
        String input = rawInput.strip();
        if (input.isEmpty()) {
            return true;
        }
        String command = input.toLowerCase(Locale.ROOT);
        switch (command) {
            case "exit":
            case "quit":
            case "stop":
                return false;
            case "help":
                showHelp();
                return true;
            case "status":
                showStatus();
                return true;
            case "goal":
                showGoal();
                return true;
            case "rules":
                showRules();
                return true;
            default:
                break;
        }
        if (input.startsWith("goal ")) {
            updateGoal(input.substring(5).strip());
        } else if (command.equals(CODE_CHANGE) || command.startsWith(CODE_CHANGE + " ")) {
            publishChange(input.substring(CODE_CHANGE.length()).strip());
        } else {
            submitRequest(input);
        }
        return true;
    }

    private void submitRequest(String request) {
        RepositoryGoal goal = reloadGoal();
        AlignmentResult alignment = context.scorer().computeAlignment(goal, request);
        logger.fine("Alignment for request: " + alignment);
        if (!alignment.aligned() && alignment.confidence() > WARN_CONFIDENCE) {
            out.println();
            out.println("Goal alignment warning:");
            out.println("   " + alignment.reason());
            out.println("   Consider if this aligns with: " + goalText());
            out.print("   Continue anyway? (y/N): ");
            out.flush();
            if (!confirmed()) {
                out.println("   Request cancelled.");
                return;
            }
        } else if (alignment.aligned() && alignment.confidence() > CONFIRM_CONFIDENCE
                && !alignment.matchingKeywords().isEmpty()) {
            out.println("Goal-aligned request (keywords: " + firstKeywords(alignment.matchingKeywords()) + ")");
        }

        Map<String, Object> prompt = new LinkedHashMap<>();
        prompt.put("prompt", request);
        prompt.put("repository_goal", goalText());
        prompt.put("aligned", alignment.aligned());
        prompt.put("confidence", alignment.confidence());
        prompt.put("timestamp", Instant.now().toString());
        prompt.put("working_directory", context.workspace().toString());
        router.sendActivity("user_prompt", prompt);
        out.println("Processing: " + (request.length() > 50 ? request.substring(0, 50) + "..." : request));
    }

    private void publishChange(String arguments) {
        String[] parts = arguments.isEmpty() ? new String[0] : arguments.split("\\s+");
        if (parts.length == 0 || !CHANGE_TYPE.matcher(parts[0].toLowerCase(Locale.ROOT)).matches()) {
            out.println("Usage: code-change <type> [file ...]");
            return;
        }
        String changeType = parts[0].toLowerCase(Locale.ROOT);
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("change_type", changeType);
        change.put("files", List.of(Arrays.copyOfRange(parts, 1, parts.length)));
        change.put("timestamp", Instant.now().toString());
        change.put("repository_goal", goalText());
        router.sendCodeChange(changeType, change);
        out.println("Code change sent: " + changeType + " (" + (parts.length - 1) + " files)");
    }

    private boolean confirmed() {
        try {
            String answer = context.in().readLine();
            if (answer == null) {
                return false;
            }
            answer = answer.strip().toLowerCase(Locale.ROOT);
            return answer.equals("y") || answer.equals("yes");
        } catch (IOException e) {
            logger.log(Level.WARNING, "Console read failed", e);
            return false;
        }
    }

    private static String firstKeywords(Set<String> keywords) {
        return String.join(", ", keywords.stream().limit(3).toArray(String[]::new));
    }

    private void updateGoal(String primary) {
        if (primary.isEmpty()) {
            out.println("Usage: goal <text>");
            return;
        }
        try {
            context.goalFile().updatePrimary(primary);
        } catch (IOException | RuntimeException e) {
            logger.log(Level.SEVERE, "Failed to update goal", e);
            out.println("Failed to update goal: " + e.getMessage());
            return;
        }
        reloadGoal();
        out.println("Goal updated: " + primary);
        Map<String, Object> update = new LinkedHashMap<>();
        update.put("new_goal", primary);
        update.put("updated_by", "human_user");
        update.put("timestamp", Instant.now().toString());
        router.sendActivity("goal_updated", update);
    }

    String goalText() {
        RepositoryGoal goal = goal();
        if (goal != null) {
            return goal.primary();
        }
        if (!context.goalFile().exists()) {
            return "No repository goal set - edit " + context.workspace().goalFile();
        }
        return "Repository goal format invalid - use the structured goal format";
    }

    private void showWelcome() {
        out.println("=".repeat(60));
        out.println("CONCLAVE - " + role().title());
        out.println("   Human interactive development hub");
        out.println("=".repeat(60));
        out.println("Repository: " + context.workspace().name());
        out.println("Goal: " + goalText());
        if (!rules().rules().isEmpty()) {
            out.println();
            out.println("Current rules:");
            rules().rules().values().forEach(rule -> out.println("   * " + rule));
        }
        out.println();
        out.println("Type 'help' for available commands, 'exit' to leave.");
        out.println(RULE);
    }

    private void showHelp() {
        out.println();
        out.println("Commands:");
        out.println("   help        - Show this help message");
        out.println("   status      - Show tool status");
        out.println("   goal        - Show current repository goal");
        out.println("   goal <text> - Update repository goal");
        out.println("   rules       - Show current protocols/rules");
        out.println("   code-change <type> [file ...]");
        out.println("               - Announce a code change to the fixer and auditor");
        out.println("   exit        - Leave the hub");
        out.println();
        out.println("Anything else is sent to the other agents as a development request,");
        out.println("e.g. 'Add user authentication' or 'Optimize database queries'.");
    }

    private void showStatus() {
        out.println();
        out.println("Status:");
        out.println("   Repository: " + context.workspace());
        out.println("   Goal: " + goalText());
        out.println("   Active rules: " + rules().rules().size());
        out.println("   Messaging: " + (router.isOnline() ? "Connected" : "Offline"));
        PidRegistry registry = new PidRegistry(context.workspace().registryFile());
        if (!registry.exists()) {
            out.println("   Running agents: PID registry not found");
            return;
        }
        try {
            out.println("   Running agents: " + registry.read().keySet());
        } catch (IOException e) {
            logger.log(Level.WARNING, "Error reading PID registry", e);
            out.println("   Running agents: unknown");
        }
    }

    private void showGoal() {
        out.println();
        out.println("Repository goal:");
        out.println("   " + goalText());
        RepositoryGoal goal = goal();
        if (goal != null && !goal.successCriteria().isEmpty()) {
            out.println("   Success criteria:");
            goal.successCriteria().forEach(c -> out.println("     - " + c));
        }
        if (context.goalFile().exists()) {
            out.println("   Full goal description in: " + context.goalFile().path());
        }
    }

    private void showRules() {
        out.println();
        out.println("Current protocols:");
        ProtocolRules rules = rules();
        if (rules.rules().isEmpty()) {
            out.println("   No specific rules defined yet");
            return;
        }
        rules.rules().forEach((key, rule) -> out.println("   * " + key + ": " + rule));
        out.println();
        out.println("   Full protocols in: " + context.workspace().protocolsDir());
    }
}
