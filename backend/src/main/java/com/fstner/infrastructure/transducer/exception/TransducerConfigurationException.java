package com.fstner.infrastructure.transducer.exception;

/**
 * Base type for errors detected while building a transducer configuration.
 * These are raised when states, transitions or definition sets are registered,
 * never during a recognition run.
 */
public abstract class TransducerConfigurationException extends RuntimeException {

    protected TransducerConfigurationException(String message) {
        super(message);
    }

    protected TransducerConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
