package dev.pekelund.medinterp.interpretation;

import dev.pekelund.medinterp.model.Interpretation;
import java.util.List;

public record InterpretationOutcome(Interpretation interpretation, List<String> rulesTriggered) {

    public InterpretationOutcome {
        rulesTriggered = rulesTriggered == null ? List.of() : List.copyOf(rulesTriggered);
    }
}
