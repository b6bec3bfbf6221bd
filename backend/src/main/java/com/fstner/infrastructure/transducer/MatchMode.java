package com.fstner.infrastructure.transducer;

import java.util.regex.Pattern;

/**
 * How a trigger pattern is applied to a token.
 */
public enum MatchMode {
    /** The whole token must match. */
    FULL,
    /** A match anywhere inside the token is enough. */
    CONTAINS;

    boolean test(Pattern pattern, String token) {
        return this == FULL
                ? pattern.matcher(token).matches()
                : pattern.matcher(token).find();
    }
}
