package dev.pekelund.medinterp.pipeline;

import java.util.Locale;

/**
 * States a submission moves through. {@link #ACCEPTED} and {@link #DISCARDED} are terminal.
 */
public enum PipelineStage {

    INGESTED,
    CLASSIFIED,
    EXTRACTED,
    NORMALIZED,
    VALIDATED,
    INTERPRETED,
    ACCEPTED,
    DISCARDED;

    public String mdcValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
