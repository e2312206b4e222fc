package dev.pekelund.medinterp.interpretation;

import dev.pekelund.medinterp.model.Interpretation;
import dev.pekelund.medinterp.model.InterpretationCategory;
import dev.pekelund.medinterp.model.Observation;
import dev.pekelund.medinterp.model.ObservationSet;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured analyte rules to a normalized observation set. The overall category is the
 * most severe category of any triggered rule.
 */
public class ClinicalInterpreter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ClinicalInterpreter.class);

    private final List<AnalyteRule> rules;
    private final InterpreterTexts texts;

    public ClinicalInterpreter(List<AnalyteRule> rules, InterpreterTexts texts) {
        this.rules = rules == null ? List.of() : List.copyOf(rules);
        this.texts = texts != null ? texts : InterpreterTexts.DEFAULT;
    }

    public InterpretationOutcome interpret(ObservationSet observationSet) {
        ObservationSet data = observationSet != null ? observationSet : ObservationSet.empty();

        InterpretationCategory category = null;
        List<String> triggered = new ArrayList<>();
        List<String> insights = new ArrayList<>();
        List<String> caveats = new ArrayList<>();
        Set<String> actions = new LinkedHashSet<>();

        for (AnalyteRule rule : rules) {
            if (rule.suppressedBy().stream().anyMatch(triggered::contains)) {
                LOGGER.debug("Rule {} suppressed by {}", rule.name(), rule.suppressedBy());
                continue;
            }
            Optional<Observation> match = rule.findObservation(data);
            if (match.isEmpty()) {
                continue;
            }
            Observation observation = match.get();
            OptionalDouble value = observation.value().asNumber();
            if (value.isEmpty()) {
                caveats.add("Could not interpret " + observation.label() + ": value '" + observation.value() + "' is not numeric");
                continue;
            }
            OptionalDouble canonical = rule.toCanonical(value.getAsDouble(), observation.unit());
            if (canonical.isEmpty()) {
                caveats.add("Could not interpret " + observation.label() + ": unit '" + observation.unit()
                    + "' cannot be converted to " + rule.canonicalUnit());
                continue;
            }
            Optional<DecisionBand> band = rule.bandFor(canonical.getAsDouble());
            if (band.isEmpty()) {
                caveats.add(String.format(Locale.ROOT, "Could not interpret %s: no decision band covers %.2f %s",
                    observation.label(), canonical.getAsDouble(), rule.canonicalUnit()));
                continue;
            }

            DecisionBand decision = band.get();
            triggered.add(rule.name());
            insights.add(decision.insight());
            if (decision.action() != null) {
                actions.add(decision.action());
            }
            if (decision.category().isMoreSevereThan(category)) {
                category = decision.category();
            }
            LOGGER.info("Rule {} evaluated {} at {} {} as {}", rule.name(), observation.label(),
                String.format(Locale.ROOT, "%.3f", canonical.getAsDouble()), rule.canonicalUnit(), decision.category());
        }

        if (triggered.isEmpty()) {
            insights.add(texts.genericInsight());
            category = anyWithinRange(data) ? InterpretationCategory.NORMAL : InterpretationCategory.INDETERMINATE;
        }
        if (data.size() < texts.limitedPanelSize()) {
            caveats.add(texts.limitedPanelCaveat());
        }
        if (category != InterpretationCategory.NORMAL && actions.isEmpty()) {
            actions.add(texts.defaultAction());
        }

        LOGGER.info("Interpretation category {} from rules {}", category, triggered);
        return new InterpretationOutcome(
            new Interpretation(category, insights, caveats, new ArrayList<>(actions)),
            triggered);
    }

    private static boolean anyWithinRange(ObservationSet data) {
        return data.observations().stream().anyMatch(observation -> {
            OptionalDouble value = observation.value().asNumber();
            return value.isPresent() && observation.referenceRange() != null
                && observation.referenceRange().contains(value.getAsDouble());
        });
    }
}
