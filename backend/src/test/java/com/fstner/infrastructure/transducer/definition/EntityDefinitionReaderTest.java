package com.fstner.infrastructure.transducer.definition;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fstner.domain.recognition.model.RecognizedEntity;
import com.fstner.infrastructure.transducer.MatchMode;
import com.fstner.infrastructure.transducer.TransducerConfiguration;
import com.fstner.infrastructure.transducer.exception.DefinitionLoadException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityDefinitionReaderTest {

    private EntityDefinitionReader reader;

    @BeforeEach
    void setUp() {
        reader = new EntityDefinitionReader(new ObjectMapper(), new DefaultResourceLoader());
    }

    @Test
    void reads_json_definition() {
        EntityDefinitionSet set = reader.read("classpath:definitions/weekdays.json");

        assertThat(set.name()).isEqualTo("weekdays");
        assertThat(set.initialState()).isNull();
        assertThat(set.states()).containsExactly("q_weekday", "q_hashtag");
        assertThat(set.transitions()).hasSize(2);
        assertThat(set.transitions().get(0).match()).isNull();
        assertThat(set.transitions().get(1).match()).isEqualTo(MatchMode.CONTAINS);
    }

    @Test
    @DisplayName("A read extension plugs into the default set")
    void extension_on_default_set() {
        EntityDefinitionSet extension = reader.read("classpath:definitions/weekdays.json");
        TransducerConfiguration configuration = new TransducerConfigurationLoader()
                .load(DefaultEntityDefinitions.create(), List.of(extension));

        List<RecognizedEntity> result = configuration.transducer()
                .run(configuration.initialState(), List.of("kedd", "#fst", "Kovács", "János"));

        assertThat(result).containsExactly(
                new RecognizedEntity("kedd", "WEEKDAY"),
                new RecognizedEntity("#fst", "HASHTAG"),
                new RecognizedEntity("Kovács János", "PERSON"));
    }

    @Test
    void missing_file() {
        assertThatThrownBy(() -> reader.read("classpath:definitions/nope.json"))
                .isInstanceOf(DefinitionLoadException.class)
                .hasMessageContaining("not found");
    }

    @Test
    void malformed_file() {
        assertThatThrownBy(() -> reader.read("classpath:definitions/malformed.json"))
                .isInstanceOf(DefinitionLoadException.class)
                .hasMessageContaining("Malformed");
    }
}
