package com.fstner.infrastructure.transducer.exception;

/**
 * A definition file could not be read or parsed.
 */
public class DefinitionLoadException extends TransducerConfigurationException {

    public DefinitionLoadException(String message) {
        super(message);
    }

    public DefinitionLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
