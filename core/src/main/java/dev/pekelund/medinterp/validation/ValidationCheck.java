package dev.pekelund.medinterp.validation;

import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ValidationFinding;
import java.time.Instant;
import java.util.Optional;

/**
 * A single sanity check applied to each observation independently.
 */
@FunctionalInterface
public interface ValidationCheck {

    Optional<ValidationFinding> check(Observation observation, Instant ingestedAt);
}
