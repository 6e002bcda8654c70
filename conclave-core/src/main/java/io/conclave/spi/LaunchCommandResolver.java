package io.conclave.spi;

import io.conclave.Role;

import java.util.List;
import java.util.Optional;

/**
 * Resolves the command line that starts the agent process of a role.
 */
@FunctionalInterface
public interface LaunchCommandResolver {

    /**
     * Returns the command for {@code role}, or empty if its executable is missing.
     * An empty result makes the supervisor skip the role without aborting the others.
     *
     * @param role the role to launch
     * @return the command and its arguments, or empty
     */
    Optional<List<String>> resolve(Role role);
}
