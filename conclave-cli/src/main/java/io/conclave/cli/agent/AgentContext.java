package io.conclave.cli.agent;

import io.conclave.Role;
import io.conclave.cli.Workspace;
import io.conclave.goal.AlignmentScorer;
import io.conclave.goal.GoalFile;
import io.conclave.protocol.ProtocolRulesLoader;
import io.conclave.router.RoleRouter;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.util.Objects;

/**
 * Collaborators shared by every agent runtime.
 */
public final class AgentContext {
    private final Role role;
    private final Workspace workspace;
    private final RoleRouter router;
    private final GoalFile goalFile;
    private final ProtocolRulesLoader rulesLoader;
    private final AlignmentScorer scorer;
    private final BufferedReader in;
    private final PrintStream out;

    private AgentContext(Builder builder) {
        this.workspace = Objects.requireNonNull(builder.workspace, "workspace");
        this.router = Objects.requireNonNull(builder.router, "router");
        this.role = router.role();
        this.goalFile = builder.goalFile != null ? builder.goalFile : new GoalFile(workspace.goalFile());
        this.rulesLoader = builder.rulesLoader != null ? builder.rulesLoader : new ProtocolRulesLoader();
        this.scorer = builder.scorer != null ? builder.scorer : AlignmentScorer.defaults();
        this.in = Objects.requireNonNull(builder.in, "in");
        this.out = Objects.requireNonNull(builder.out, "out");
    }

    public static Builder builder() {
        return new Builder();
    }

    public Role role() {
        return role;
    }

    public Workspace workspace() {
        return workspace;
    }

    public RoleRouter router() {
        return router;
    }

    public GoalFile goalFile() {
        return goalFile;
    }

    public ProtocolRulesLoader rulesLoader() {
        return rulesLoader;
    }

    public AlignmentScorer scorer() {
        return scorer;
    }

    public BufferedReader in() {
        return in;
    }

    public PrintStream out() {
        return out;
    }

    public static final class Builder {
        private Workspace workspace;
        private RoleRouter router;
        private GoalFile goalFile;
        private ProtocolRulesLoader rulesLoader;
        private AlignmentScorer scorer;
        private BufferedReader in;
        private PrintStream out;

        private Builder() {
        }

        public Builder workspace(Workspace workspace) {
            this.workspace = workspace;
            return this;
        }

        public Builder router(RoleRouter router) {
            this.router = router;
            return this;
        }

        public Builder goalFile(GoalFile goalFile) {
            this.goalFile = goalFile;
            return this;
        }

        public Builder rulesLoader(ProtocolRulesLoader rulesLoader) {
            this.rulesLoader = rulesLoader;
            return this;
        }

        public Builder scorer(AlignmentScorer scorer) {
            this.scorer = scorer;
            return this;
        }

        /** Console input; only the hub reads it. */
        public Builder in(BufferedReader in) {
            this.in = in;
            return this;
        }

        public Builder out(PrintStream out) {
            this.out = out;
            return this;
        }

        public AgentContext build() {
            return new AgentContext(this);
        }
    }
}
