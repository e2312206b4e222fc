package dev.pekelund.medinterp.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Terminal, immutable outcome of one pipeline run.
 */
@JsonPropertyOrder({"reportId", "reportType", "sourceFormat", "ingestedAt", "patient", "data", "interpretation",
    "audit", "references", "status", "userFeedback"})
public record PipelineResult(
    String reportId,
    ReportType reportType,
    SourceFormat sourceFormat,
    Instant ingestedAt,
    PatientInfo patient,
    ObservationSet data,
    Interpretation interpretation,
    AuditTrail audit,
    List<String> references,
    ReportStatus status,
    @JsonInclude(JsonInclude.Include.NON_NULL) String userFeedback
) {

    public PipelineResult {
        Objects.requireNonNull(reportId, "reportId");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(ingestedAt, "ingestedAt");
        data = data != null ? data : ObservationSet.empty();
        interpretation = interpretation != null ? interpretation : Interpretation.none();
        references = references == null ? List.of() : List.copyOf(references);
        if (status == ReportStatus.DISCARDED) {
            if (!data.isEmpty()) {
                throw new IllegalArgumentException("Discarded results must not carry observations");
            }
            if (userFeedback == null || userFeedback.isBlank()) {
                throw new IllegalArgumentException("Discarded results must carry user feedback");
            }
        } else if (userFeedback != null) {
            throw new IllegalArgumentException("Accepted results must not carry user feedback");
        }
    }

    @JsonIgnore
    public boolean isAccepted() {
        return status == ReportStatus.ACCEPTED;
    }
}
