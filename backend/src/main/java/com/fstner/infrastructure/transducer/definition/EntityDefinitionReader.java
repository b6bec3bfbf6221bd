package com.fstner.infrastructure.transducer.definition;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fstner.infrastructure.transducer.exception.DefinitionLoadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;

/**
 * Reads {@link EntityDefinitionSet}s from JSON resources ({@code classpath:}, {@code file:}, ...).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EntityDefinitionReader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public EntityDefinitionSet read(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            throw new DefinitionLoadException("Definition file not found: " + location);
        }

        EntityDefinitionSet set;
        try (InputStream in = resource.getInputStream()) {
            set = objectMapper.readValue(in, EntityDefinitionSet.class);
        } catch (JsonProcessingException e) {
            throw new DefinitionLoadException("Malformed definition file " + location + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new DefinitionLoadException("Cannot read definition file " + location, e);
        }

        if (set == null) {
            throw new DefinitionLoadException("Empty definition file: " + location);
        }
        if (set.name() == null || set.name().isBlank()) {
            set = new EntityDefinitionSet(location, set.initialState(), set.states(), set.transitions());
        }

        log.info("[DefinitionReader] Read '{}' from {}: {} states, {} transitions",
                set.name(), location, set.states().size(), set.transitions().size());
        return set;
    }
}
