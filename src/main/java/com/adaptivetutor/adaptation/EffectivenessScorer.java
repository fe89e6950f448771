package com.adaptivetutor.adaptation;

import com.adaptivetutor.domain.model.Adaptation;
import com.adaptivetutor.domain.model.SessionSnapshot;
import java.util.OptionalDouble;

/**
 * Extension point for back-filling {@link Adaptation#getEffectivenessScore()} after the fact.
 *
 * <p>Offered, during each periodic review, every adaptation of the session that still has a
 * zero score. A present result in [0, 1] is written back onto the record; an empty result leaves it
 * untouched and the adaptation is offered again on the next review.
 */
public interface EffectivenessScorer {

    OptionalDouble score(SessionSnapshot session, Adaptation adaptation);
}
