package com.fstner.infrastructure.transducer;

import com.fstner.infrastructure.transducer.exception.UnknownStateException;

/**
 * A loaded, immutable transducer setup: the table plus the state every run starts in.
 */
public record TransducerConfiguration(
        String initialState,
        TransitionTable transitionTable
) {

    public TransducerConfiguration {
        if (!transitionTable.hasState(initialState)) {
            throw new UnknownStateException(initialState);
        }
    }

    public FiniteStateTransducer transducer() {
        return new FiniteStateTransducer(transitionTable);
    }

    /**
     * Same initial state, different table. Used when extending a running configuration.
     */
    public TransducerConfiguration withTable(TransitionTable table) {
        return new TransducerConfiguration(initialState, table);
    }
}
