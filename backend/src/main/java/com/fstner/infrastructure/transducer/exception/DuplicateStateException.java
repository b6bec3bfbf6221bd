package com.fstner.infrastructure.transducer.exception;

public class DuplicateStateException extends TransducerConfigurationException {

    private final String stateId;

    public DuplicateStateException(String stateId) {
        super("State already registered: " + stateId);
        this.stateId = stateId;
    }

    public String getStateId() {
        return stateId;
    }
}
