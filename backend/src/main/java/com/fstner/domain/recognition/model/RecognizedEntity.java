package com.fstner.domain.recognition.model;

/**
 * Value object for one recognized entity.
 *
 * @param text     the matched tokens joined by a single space
 * @param category the category code emitted by the closing transition (e.g. "PERSON")
 */
public record RecognizedEntity(
        String text,
        String category
) {}
