package com.gsesentinel.core.command;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A named safety condition that must hold before a command is admitted.
 *
 * @since 1.0.0
 */
public final class Interlock {

    private final String name;
    private final Predicate<InterlockContext> condition;
    private final Function<InterlockContext, String> violationMessage;

    private Interlock(String name, Predicate<InterlockContext> condition,
            Function<InterlockContext, String> violationMessage) {
        this.name = Objects.requireNonNull(name, "name must not be null");
        this.condition = Objects.requireNonNull(condition, "condition must not be null");
        this.violationMessage = Objects.requireNonNull(violationMessage, "violationMessage must not be null");
    }

    /**
     * @param name             short rule name used in logs
     * @param condition        must be {@code true} for the command to pass
     * @param violationMessage operator-facing message when it does not
     * @return a new interlock
     */
    public static Interlock require(String name, Predicate<InterlockContext> condition,
            Function<InterlockContext, String> violationMessage) {
        return new Interlock(name, condition, violationMessage);
    }

    /**
     * @param context evaluation context
     * @return the violation message, or empty if the condition holds
     */
    public Optional<String> check(InterlockContext context) {
        return condition.test(context) ? Optional.empty() : Optional.of(violationMessage.apply(context));
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "Interlock{" + name + '}';
    }
}
