package com.fstner.infrastructure.transducer.definition;

import com.fstner.infrastructure.transducer.MatchMode;

/**
 * Declarative form of one transition.
 *
 * @param from    source state id
 * @param pattern regular expression tested against a single token
 * @param to      destination state id
 * @param label   category emitted when the transition fires; null for a continuation
 * @param match   how the pattern is applied; null means {@link MatchMode#FULL}
 */
public record TransitionDefinition(
        String from,
        String pattern,
        String to,
        String label,
        MatchMode match
) {

    public static TransitionDefinition continuation(String from, String pattern, String to) {
        return new TransitionDefinition(from, pattern, to, null, MatchMode.FULL);
    }

    public static TransitionDefinition labeled(String from, String pattern, String to, String label) {
        return new TransitionDefinition(from, pattern, to, label, MatchMode.FULL);
    }
}
