package com.fstner.infrastructure.transducer.exception;

public class UnknownStateException extends TransducerConfigurationException {

    private final String stateId;

    public UnknownStateException(String stateId) {
        super("State not registered: " + stateId);
        this.stateId = stateId;
    }

    public String getStateId() {
        return stateId;
    }
}
