package com.fstner.infrastructure.transducer;

import com.fstner.domain.recognition.model.RecognizedEntity;
import com.fstner.infrastructure.transducer.exception.UnknownStateException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Walks a {@link TransitionTable} over a token sequence and collects labeled spans.
 *
 * <p>Per token, the transitions of the current state are tried in registration order
 * and the first match is taken. Matched tokens accumulate in a pending span. A labeled
 * transition closes the span, emits it and returns the machine to the initial state.</p>
 *
 * <p>When no transition of a non-initial state matches, the pending span is dropped and
 * the same token is tried once more from the initial state. A token that matches nothing
 * at the initial state is skipped. A pending span left over at the end of the input is
 * dropped, so only spans closed by a labeled transition reach the output.</p>
 *
 * <p>The transducer keeps no per-run state and may be shared between threads.</p>
 */
@Slf4j
public class FiniteStateTransducer {

    private final TransitionTable table;

    public FiniteStateTransducer(TransitionTable table) {
        this.table = table;
    }

    /**
     * Recognize entities in a token sequence.
     *
     * @param initialState state the machine starts in and returns to after each entity
     * @param tokens       tokens in input order
     * @return recognized entities in order of occurrence; empty if none
     * @throws UnknownStateException if {@code initialState} is not registered in the table
     */
    public List<RecognizedEntity> run(String initialState, List<String> tokens) {
        if (!table.hasState(initialState)) {
            throw new UnknownStateException(initialState);
        }
        if (tokens == null || tokens.isEmpty()) {
            return List.of();
        }

        RunState run = new RunState(initialState);

        while (run.index < tokens.size()) {
            String token = tokens.get(run.index);
            Transition transition = firstMatch(run.current, token);

            if (transition != null) {
                consume(run, token, transition);
                run.index++;
                run.retried = false;
                continue;
            }

            if (!run.atInitialState() && !run.retried) {
                // Broken multi-token match: drop the span, retry this token from the start
                run.discardPending(token);
                run.current = initialState;
                run.retried = true;
                continue;
            }

            run.discardPending(token);
            run.current = initialState;
            run.index++;
            run.retried = false;
        }

        if (!run.pending.isEmpty()) {
            log.debug("[Transducer] Dropping unfinished span '{}' at end of input", String.join(" ", run.pending));
        }

        return run.output;
    }

    private Transition firstMatch(String state, String token) {
        for (Transition transition : table.transitionsFor(state)) {
            if (transition.matches(token)) {
                return transition;
            }
        }
        return null;
    }

    private void consume(RunState run, String token, Transition transition) {
        if (!table.hasState(transition.destination())) {
            throw new IllegalStateException("Transition " + transition + " points to unregistered state");
        }

        run.pending.add(token);
        run.current = transition.destination();

        if (transition.isLabeled()) {
            RecognizedEntity entity = new RecognizedEntity(String.join(" ", run.pending), transition.label());
            run.output.add(entity);
            log.debug("[Transducer] Emitted {} '{}'", entity.category(), entity.text());
            run.pending.clear();
            run.current = run.initialState;
        }
    }

    /**
     * Traversal context of a single {@link #run} call.
     */
    private static final class RunState {

        private final String initialState;
        private final List<String> pending = new ArrayList<>();
        private final List<RecognizedEntity> output = new ArrayList<>();
        private String current;
        private int index;
        private boolean retried;

        private RunState(String initialState) {
            this.initialState = initialState;
            this.current = initialState;
        }

        private boolean atInitialState() {
            return current.equals(initialState);
        }

        private void discardPending(String breakingToken) {
            if (!pending.isEmpty()) {
                log.debug("[Transducer] Span '{}' broken by '{}', discarding",
                        String.join(" ", pending), breakingToken);
                pending.clear();
            }
        }
    }
}
