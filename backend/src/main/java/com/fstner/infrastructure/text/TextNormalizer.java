package com.fstner.infrastructure.text;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Normalizes input text before tokenization:
 * - Unicode NFC normalization, so decomposed accents ("a" + U+0301) match letter classes
 * - Invisible/control character removal
 * - Whitespace normalization (every run, newlines included, becomes one space; trim)
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except whitespace (\t, \n, \r)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    // No-break and other Unicode spaces count as separators too
    private static final Pattern WHITESPACE_RUN = Pattern.compile("[\\s\\u00A0\\u2007\\u202F]+");

    /**
     * Normalize the input text.
     *
     * @param text raw input
     * @return normalized text; null and empty input are returned unchanged
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = WHITESPACE_RUN.matcher(result).replaceAll(" ");

        return result.strip();
    }
}
