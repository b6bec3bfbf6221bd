package com.fstner.infrastructure.text;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits on whitespace and strips configured characters from both ends of each token,
 * so "2024.12.10." and "János." reach the transducer as "2024.12.10" and "János".
 * Tokens left empty by stripping are dropped.
 */
@Component
public class WhitespaceTokenizer implements Tokenizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final String stripChars;

    public WhitespaceTokenizer(@Value("${ner.tokenizer.strip-chars:.}") String stripChars) {
        this.stripChars = stripChars == null ? "" : stripChars;
    }

    @Override
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        for (String raw : WHITESPACE.split(text.strip())) {
            String token = strip(raw);
            if (!token.isEmpty()) {
                tokens.add(token);
            }
        }
        return tokens;
    }

    private String strip(String token) {
        int start = 0;
        int end = token.length();
        while (start < end && stripChars.indexOf(token.charAt(start)) >= 0) {
            start++;
        }
        while (end > start && stripChars.indexOf(token.charAt(end - 1)) >= 0) {
            end--;
        }
        return token.substring(start, end);
    }
}
