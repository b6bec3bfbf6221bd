package com.fstner.infrastructure.transducer.definition;

import com.fstner.infrastructure.transducer.TransducerConfiguration;
import com.fstner.infrastructure.transducer.TransitionTable;
import com.fstner.infrastructure.transducer.exception.DefinitionLoadException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link TransducerConfiguration} from a base definition set and optional extensions.
 *
 * <p>All states of every set are registered before any transition, so an extension may
 * route into states declared by a later set. Transitions are appended in set order, which
 * puts extension transitions behind the base ones when several match the same token.
 * Loading works on a fresh builder: a failing set leaves nothing half-applied.</p>
 */
@Slf4j
@Component
public class TransducerConfigurationLoader {

    public TransducerConfiguration load(EntityDefinitionSet base) {
        return load(base, List.of());
    }

    /**
     * @throws com.fstner.infrastructure.transducer.exception.TransducerConfigurationException
     *         on the first duplicate state, unknown state or invalid pattern
     */
    public TransducerConfiguration load(EntityDefinitionSet base, List<EntityDefinitionSet> extensions) {
        if (base.initialState() == null || base.initialState().isBlank()) {
            throw new DefinitionLoadException("Definition set '" + base.name() + "' declares no initial state");
        }

        List<EntityDefinitionSet> sets = new ArrayList<>();
        sets.add(base);
        for (EntityDefinitionSet extension : extensions) {
            if (extension.initialState() != null && !extension.initialState().equals(base.initialState())) {
                log.warn("[Loader] Extension '{}' declares initial state '{}', keeping '{}'",
                        extension.name(), extension.initialState(), base.initialState());
            }
            sets.add(extension);
        }

        TransitionTable.Builder builder = TransitionTable.builder();
        for (EntityDefinitionSet set : sets) {
            set.states().forEach(builder::addState);
        }
        for (EntityDefinitionSet set : sets) {
            for (TransitionDefinition transition : set.transitions()) {
                builder.addTransition(transition.from(), transition.pattern(), transition.to(),
                        transition.label(), transition.match());
            }
        }

        TransitionTable table = builder.build();
        TransducerConfiguration configuration = new TransducerConfiguration(base.initialState(), table);

        log.info("[Loader] Loaded definition sets {}: {} states, {} transitions, initial state '{}'",
                sets.stream().map(EntityDefinitionSet::name).toList(),
                table.states().size(), table.transitions().size(), base.initialState());

        return configuration;
    }
}
