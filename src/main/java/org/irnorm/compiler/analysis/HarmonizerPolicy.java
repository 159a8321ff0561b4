package org.irnorm.compiler.analysis;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Tie-break policy for tagged-payload binders when more than one name is undefined in a clause.
 *
 * @param payloadNamePriority Candidate names, highest priority first.
 */
public record HarmonizerPolicy(List<String> payloadNamePriority) {

    /** The priority list used when no configuration overrides it. */
    public static final List<String> DEFAULT_PRIORITY = List.of("id", "value", "result", "data", "reason", "error");

    public HarmonizerPolicy {
        payloadNamePriority = List.copyOf(payloadNamePriority);
    }

    /**
     * @return The policy with {@link #DEFAULT_PRIORITY}.
     */
    public static HarmonizerPolicy defaults() {
        return new HarmonizerPolicy(DEFAULT_PRIORITY);
    }

    /**
     * @param undefined The undefined names of a clause.
     * @return The highest-priority name among them, if any is listed.
     */
    public Optional<String> pick(Collection<String> undefined) {
        return payloadNamePriority.stream().filter(undefined::contains).findFirst();
    }
}
