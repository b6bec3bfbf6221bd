package com.fstner.infrastructure.text;

import java.util.List;

/**
 * Splits text into the ordered token sequence the transducer consumes.
 */
public interface Tokenizer {

    /**
     * @param text input text, may be null
     * @return tokens in input order; empty for null or blank text
     */
    List<String> tokenize(String text);
}
