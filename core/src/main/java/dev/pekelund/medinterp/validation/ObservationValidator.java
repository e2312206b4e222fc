package dev.pekelund.medinterp.validation;

import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import dev.pekelund.medinterp.model.ValidationFinding;
import dev.pekelund.medinterp.model.ValidationOutcome;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs every {@link ValidationCheck} over every observation. A set without findings yields a
 * single passing finding.
 */
public class ObservationValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObservationValidator.class);

    static final String ALL_PASSED = "All validation checks passed";

    private final List<ValidationCheck> checks;

    public ObservationValidator(List<ValidationCheck> checks) {
        this.checks = List.copyOf(checks);
    }

    public static ObservationValidator withDefaultChecks(Set<String> numericUnits) {
        return new ObservationValidator(List.of(
            ObservationChecks.numericValueForNumericUnit(numericUnits),
            ObservationChecks.rangeUnitMatchesObservationUnit(),
            ObservationChecks.collectedNotAfterIngestion(),
            ObservationChecks.unitPresent(),
            ObservationChecks.outlier()));
    }

    public List<ValidationFinding> validate(ObservationSet observationSet, Instant ingestedAt) {
        List<ValidationFinding> findings = new ArrayList<>();
        if (observationSet != null) {
            for (Observation observation : observationSet.observations()) {
                for (ValidationCheck check : checks) {
                    check.check(observation, ingestedAt).ifPresent(findings::add);
                }
            }
        }
        if (findings.isEmpty()) {
            findings.add(ValidationFinding.pass(ALL_PASSED));
        }

        long failures = findings.stream().filter(ValidationFinding::isFailure).count();
        long warnings = findings.stream().filter(finding -> finding.outcome() == ValidationOutcome.WARN).count();
        LOGGER.info("Validation produced {} findings ({} fail, {} warn)", findings.size(), failures, warnings);
        return List.copyOf(findings);
    }

    public static boolean hasFailure(List<ValidationFinding> findings) {
        return findings.stream().anyMatch(ValidationFinding::isFailure);
    }
}
