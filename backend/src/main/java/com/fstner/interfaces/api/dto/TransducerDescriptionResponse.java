package com.fstner.interfaces.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fstner.infrastructure.transducer.MatchMode;
import com.fstner.infrastructure.transducer.TransducerConfiguration;

import java.util.List;

public record TransducerDescriptionResponse(
        String initialState,
        List<String> states,
        List<TransitionEntry> transitions
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TransitionEntry(String from, String pattern, String to, String label, MatchMode match) {}

    public static TransducerDescriptionResponse from(TransducerConfiguration configuration) {
        return new TransducerDescriptionResponse(
                configuration.initialState(),
                configuration.transitionTable().states(),
                configuration.transitionTable().transitions().stream()
                        .map(t -> new TransitionEntry(t.source(), t.pattern(), t.destination(), t.label(), t.matchMode()))
                        .toList());
    }
}
