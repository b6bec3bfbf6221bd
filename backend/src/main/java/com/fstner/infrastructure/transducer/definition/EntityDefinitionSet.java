package com.fstner.infrastructure.transducer.definition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * A named set of states and transitions, as found in the built-in default set or in a
 * JSON definition file.
 *
 * <pre>
 * {
 *   "name": "weekdays",
 *   "states": ["q_weekday"],
 *   "transitions": [
 *     {"from": "q0", "pattern": "hétfő|kedd", "to": "q_weekday", "label": "WEEKDAY"}
 *   ]
 * }
 * </pre>
 *
 * @param name         set name, used in logs
 * @param initialState start state; optional for extension sets
 * @param states       states this set registers
 * @param transitions  transitions in priority order
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityDefinitionSet(
        String name,
        String initialState,
        List<String> states,
        List<TransitionDefinition> transitions
) {

    public EntityDefinitionSet {
        states = states == null ? List.of() : List.copyOf(states);
        transitions = transitions == null ? List.of() : List.copyOf(transitions);
    }
}
