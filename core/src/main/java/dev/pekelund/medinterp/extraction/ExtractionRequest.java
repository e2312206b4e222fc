package dev.pekelund.medinterp.extraction;

import dev.pekelund.medinterp.model.ReportType;
import java.util.Objects;

/**
 * Input handed to an {@link ObservationExtractor}. The report type selects the response schema.
 */
public record ExtractionRequest(String text, ReportType reportType) {

    public ExtractionRequest {
        text = text != null ? text : "";
        Objects.requireNonNull(reportType, "reportType");
    }
}
