package com.fstner.infrastructure.transducer;

import com.fstner.infrastructure.transducer.exception.InvalidPatternException;
import com.fstner.infrastructure.transducer.exception.UnknownStateException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Immutable, ordered transitions keyed by source state.
 *
 * <p>Tables are assembled with a {@link Builder}, which validates states and
 * compiles patterns as transitions are added. Once built, a table can be shared
 * by any number of concurrent runs. To extend a table, derive a new builder with
 * {@link #toBuilder()} and build a new table.</p>
 */
public final class TransitionTable {

    private final StateRegistry registry;
    private final Map<String, List<Transition>> transitionsBySource;
    private final List<Transition> transitions;

    private TransitionTable(StateRegistry registry, List<Transition> transitions) {
        this.registry = registry;
        this.transitions = List.copyOf(transitions);

        Map<String, List<Transition>> grouped = new LinkedHashMap<>();
        for (Transition transition : this.transitions) {
            grouped.computeIfAbsent(transition.source(), k -> new ArrayList<>()).add(transition);
        }
        Map<String, List<Transition>> frozen = new LinkedHashMap<>();
        grouped.forEach((source, list) -> frozen.put(source, List.copyOf(list)));
        this.transitionsBySource = Map.copyOf(frozen);
    }

    public static Builder builder() {
        return new Builder(new StateRegistry(), List.of());
    }

    /**
     * Start a new builder holding this table's states and transitions.
     * The table itself is not affected by changes to the builder.
     */
    public Builder toBuilder() {
        return new Builder(registry.copy(), transitions);
    }

    /**
     * @return transitions leaving {@code source} in registration order;
     *         empty when the state has no outgoing moves
     */
    public List<Transition> transitionsFor(String source) {
        return transitionsBySource.getOrDefault(source, List.of());
    }

    public boolean hasState(String id) {
        return registry.hasState(id);
    }

    public List<String> states() {
        return registry.states();
    }

    /**
     * @return every transition in registration order
     */
    public List<Transition> transitions() {
        return transitions;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TransitionTable other)) return false;
        return registry.view().equals(other.registry.view()) && transitions.equals(other.transitions);
    }

    @Override
    public int hashCode() {
        return 31 * registry.view().hashCode() + transitions.hashCode();
    }

    /**
     * Mutable build stage. Not thread-safe.
     */
    public static final class Builder {

        private final StateRegistry registry;
        private final List<Transition> transitions;

        private Builder(StateRegistry registry, List<Transition> transitions) {
            this.registry = registry;
            this.transitions = new ArrayList<>(transitions);
        }

        public Builder addState(String id) {
            registry.addState(id);
            return this;
        }

        public boolean hasState(String id) {
            return registry.hasState(id);
        }

        public Builder addTransition(String source, String pattern, String destination) {
            return addTransition(source, pattern, destination, null, MatchMode.FULL);
        }

        public Builder addTransition(String source, String pattern, String destination, String label) {
            return addTransition(source, pattern, destination, label, MatchMode.FULL);
        }

        /**
         * Append a transition after all transitions already registered for {@code source}.
         *
         * @param label category to emit when this transition fires; null or blank for none
         * @throws UnknownStateException   if {@code source} or {@code destination} is not registered
         * @throws InvalidPatternException if {@code pattern} does not compile
         */
        public Builder addTransition(String source, String pattern, String destination,
                                     String label, MatchMode matchMode) {
            if (!registry.hasState(source)) {
                throw new UnknownStateException(source);
            }
            if (!registry.hasState(destination)) {
                throw new UnknownStateException(destination);
            }
            if (pattern == null) {
                throw new IllegalArgumentException("Trigger pattern must not be null");
            }

            Pattern compiled;
            try {
                compiled = Pattern.compile(pattern);
            } catch (PatternSyntaxException e) {
                throw new InvalidPatternException(pattern, e);
            }

            String effectiveLabel = label == null || label.isBlank() ? null : label;
            MatchMode effectiveMode = matchMode == null ? MatchMode.FULL : matchMode;
            transitions.add(new Transition(source, compiled, destination, effectiveLabel, effectiveMode));
            return this;
        }

        public TransitionTable build() {
            return new TransitionTable(registry.copy(), transitions);
        }
    }
}
