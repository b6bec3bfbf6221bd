package com.fstner.infrastructure.transducer.definition;

import com.fstner.infrastructure.transducer.TransducerConfiguration;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Arrays;
import java.util.List;

/**
 * Loads the startup transducer: the built-in set plus the JSON files listed in
 * {@code ner.definitions.locations}. A broken definition file stops the application.
 */
@Configuration
public class TransducerDefinitionConfig {

    @Value("${ner.definitions.locations:}")
    private String[] definitionLocations;

    @Bean
    public TransducerConfiguration transducerConfiguration(TransducerConfigurationLoader loader,
                                                           EntityDefinitionReader reader) {
        List<EntityDefinitionSet> extensions = Arrays.stream(definitionLocations)
                .map(String::trim)
                .filter(location -> !location.isEmpty())
                .map(reader::read)
                .toList();

        return loader.load(DefaultEntityDefinitions.create(), extensions);
    }
}
