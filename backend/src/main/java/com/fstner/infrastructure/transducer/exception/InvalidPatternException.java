package com.fstner.infrastructure.transducer.exception;

import java.util.regex.PatternSyntaxException;

public class InvalidPatternException extends TransducerConfigurationException {

    private final String pattern;

    public InvalidPatternException(String pattern, PatternSyntaxException cause) {
        super("Invalid trigger pattern '" + pattern + "': " + cause.getDescription(), cause);
        this.pattern = pattern;
    }

    public String getPattern() {
        return pattern;
    }
}
