package com.adaptivetutor.adaptation.impl;

import com.adaptivetutor.adaptation.EffectivenessScorer;
import com.adaptivetutor.domain.model.Adaptation;
import com.adaptivetutor.domain.model.SessionSnapshot;
import java.util.OptionalDouble;
import org.springframework.stereotype.Component;

/**
 * Default scorer: never back-fills. Replace by declaring a {@code @Primary} {@link EffectivenessScorer} bean.
 */
@Component
public class NoOpEffectivenessScorer implements EffectivenessScorer {

    @Override
    public OptionalDouble score(SessionSnapshot session, Adaptation adaptation) {
        return OptionalDouble.empty();
    }
}
