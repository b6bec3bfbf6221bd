package com.fstner.infrastructure.transducer;

import com.fstner.infrastructure.transducer.exception.DuplicateStateException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Additive set of known state ids. States can be registered but never removed.
 */
public class StateRegistry {

    private final Set<String> states = new LinkedHashSet<>();

    public StateRegistry() {
    }

    private StateRegistry(Set<String> states) {
        this.states.addAll(states);
    }

    /**
     * Register a new state id.
     *
     * @throws DuplicateStateException  if the id is already registered
     * @throws IllegalArgumentException if the id is null or blank
     */
    public void addState(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("State id must not be blank");
        }
        if (!states.add(id)) {
            throw new DuplicateStateException(id);
        }
    }

    public boolean hasState(String id) {
        return id != null && states.contains(id);
    }

    /**
     * @return the registered ids in registration order (read-only)
     */
    public List<String> states() {
        return List.copyOf(states);
    }

    public int size() {
        return states.size();
    }

    StateRegistry copy() {
        return new StateRegistry(states);
    }

    Set<String> view() {
        return Collections.unmodifiableSet(states);
    }
}
