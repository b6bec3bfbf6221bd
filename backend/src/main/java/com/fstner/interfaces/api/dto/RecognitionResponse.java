package com.fstner.interfaces.api.dto;

import com.fstner.domain.recognition.model.RecognizedEntity;

import java.util.List;

public record RecognitionResponse(List<EntityEntry> entities) {

    public record EntityEntry(String text, String category) {}

    public static RecognitionResponse from(List<RecognizedEntity> entities) {
        return new RecognitionResponse(entities.stream()
                .map(e -> new EntityEntry(e.text(), e.category()))
                .toList());
    }
}
