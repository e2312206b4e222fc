package dev.pekelund.medinterp.extraction;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Intermediate schema the extractor response is parsed into. Every field is optional; any type
 * mismatch fails the parse.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
record ExtractedPanel(
    @JsonAlias({"panel_name", "panel"}) String panelName,
    List<ExtractedObservation> observations
) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractedObservation(
        String code,
        @JsonAlias({"name", "display_name"}) String display,
        JsonNode value,
        String unit,
        @JsonAlias({"reference_range", "range"}) ExtractedRange referenceRange,
        @JsonAlias({"collected_at", "collectionDate", "collection_date"}) String collectedAt,
        List<String> flags
    ) { }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ExtractedRange(Double low, Double high, String unit) { }
}
