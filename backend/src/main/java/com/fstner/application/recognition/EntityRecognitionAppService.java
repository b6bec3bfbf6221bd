package com.fstner.application.recognition;

import com.fstner.domain.recognition.model.RecognizedEntity;
import com.fstner.infrastructure.text.TextNormalizer;
import com.fstner.infrastructure.text.Tokenizer;
import com.fstner.infrastructure.transducer.MatchMode;
import com.fstner.infrastructure.transducer.TransducerConfiguration;
import com.fstner.infrastructure.transducer.TransitionTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for recognition: normalize → tokenize → run the transducer.
 *
 * <p>Holds the current {@link TransducerConfiguration} as an immutable snapshot.
 * Extensions derive a new table from the snapshot and swap it in, so a run that is
 * already in progress finishes against the table it started with. Mutations are
 * serialized; reads take no lock.</p>
 */
@Slf4j
@Service
public class EntityRecognitionAppService {

    private final TextNormalizer textNormalizer;
    private final Tokenizer tokenizer;

    private volatile TransducerConfiguration configuration;

    public EntityRecognitionAppService(TextNormalizer textNormalizer,
                                       Tokenizer tokenizer,
                                       TransducerConfiguration configuration) {
        this.textNormalizer = textNormalizer;
        this.tokenizer = tokenizer;
        this.configuration = configuration;
    }

    /**
     * Recognize entities in free text.
     *
     * @return entities in order of appearance; empty for null or blank text
     */
    public List<RecognizedEntity> recognize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<String> tokens = tokenizer.tokenize(textNormalizer.normalize(text));
        return recognizeTokens(tokens);
    }

    /**
     * Recognize entities in an already tokenized sequence.
     */
    public List<RecognizedEntity> recognizeTokens(List<String> tokens) {
        TransducerConfiguration snapshot = configuration;
        List<RecognizedEntity> entities = snapshot.transducer().run(snapshot.initialState(), tokens);
        log.debug("[Recognition] {} tokens → {} entities", tokens == null ? 0 : tokens.size(), entities.size());
        return entities;
    }

    public synchronized TransducerConfiguration addState(String id) {
        TransitionTable table = configuration.transitionTable().toBuilder()
                .addState(id)
                .build();
        configuration = configuration.withTable(table);
        log.info("[Recognition] Registered state '{}'", id);
        return configuration;
    }

    public synchronized TransducerConfiguration addTransition(String from, String pattern, String to,
                                                              String label, MatchMode matchMode) {
        TransitionTable table = configuration.transitionTable().toBuilder()
                .addTransition(from, pattern, to, label, matchMode)
                .build();
        configuration = configuration.withTable(table);
        log.info("[Recognition] Registered transition {} --/{}/--> {} (label={})", from, pattern, to, label);
        return configuration;
    }

    public TransducerConfiguration currentConfiguration() {
        return configuration;
    }
}
