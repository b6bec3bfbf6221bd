package com.fstner.infrastructure.transducer;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One move of the transducer: from {@code source} to {@code destination} when
 * {@code trigger} matches the current token. A non-null {@code label} closes the
 * pending span and emits it under that category.
 *
 * <p>Two transitions are equal when their states, label, match mode and pattern
 * source and flags are equal; {@link Pattern} itself has identity equality.</p>
 */
public record Transition(
        String source,
        Pattern trigger,
        String destination,
        String label,
        MatchMode matchMode
) {

    public boolean matches(String token) {
        return matchMode.test(trigger, token);
    }

    public boolean isLabeled() {
        return label != null;
    }

    public String pattern() {
        return trigger.pattern();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transition other)) return false;
        return source.equals(other.source)
                && destination.equals(other.destination)
                && Objects.equals(label, other.label)
                && matchMode == other.matchMode
                && trigger.pattern().equals(other.trigger.pattern())
                && trigger.flags() == other.trigger.flags();
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, destination, label, matchMode, trigger.pattern(), trigger.flags());
    }

    @Override
    public String toString() {
        return source + " --/" + trigger.pattern() + "/" + (isLabeled() ? "[" + label + "]" : "") + "--> " + destination;
    }
}
