package dev.pekelund.medinterp.pipeline;

import dev.pekelund.medinterp.classification.ReportTypeClassifier;
import dev.pekelund.medinterp.extraction.BoundedObservationExtraction;
import dev.pekelund.medinterp.extraction.ExtractionOutcome;
import dev.pekelund.medinterp.extraction.ExtractionRequest;
import dev.pekelund.medinterp.extraction.ExtractionResponseParser;
import dev.pekelund.medinterp.extraction.ObservationExtractor;
import dev.pekelund.medinterp.extraction.ObservationExtractorRegistry;
import dev.pekelund.medinterp.interpretation.ClinicalInterpreter;
import dev.pekelund.medinterp.interpretation.InterpretationOutcome;
import dev.pekelund.medinterp.model.AuditTrail;
import dev.pekelund.medinterp.model.PatientInfo;
import dev.pekelund.medinterp.model.PipelineResult;
import dev.pekelund.medinterp.model.ReportStatus;
import dev.pekelund.medinterp.model.ReportText;
import dev.pekelund.medinterp.model.ReportType;
import dev.pekelund.medinterp.model.SourceFormat;
import dev.pekelund.medinterp.model.TypeDetection;
import dev.pekelund.medinterp.model.UnitConversionRecord;
import dev.pekelund.medinterp.model.ValidationFinding;
import dev.pekelund.medinterp.normalization.NormalizationOutcome;
import dev.pekelund.medinterp.normalization.UnitNormalizer;
import dev.pekelund.medinterp.validation.ObservationValidator;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a submitted report through classification, extraction, normalization, validation and
 * interpretation, discarding it at the first confidence gate it fails. {@link #interpret} never
 * throws: unexpected failures become a {@code system_error} discard.
 */
public class ReportInterpretationPipeline {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportInterpretationPipeline.class);

    private final PipelineConfiguration configuration;
    private final ReportTypeClassifier classifier;
    private final ObservationExtractorRegistry extractors;
    private final BoundedObservationExtraction extraction;
    private final UnitNormalizer normalizer;
    private final ObservationValidator validator;
    private final ClinicalInterpreter interpreter;
    private final Clock clock;
    private final Supplier<String> reportIds;

    public ReportInterpretationPipeline(PipelineConfiguration configuration, ObservationExtractorRegistry extractors,
        Executor executor) {
        this(configuration, extractors, executor, Clock.systemUTC(), null);
    }

    public ReportInterpretationPipeline(PipelineConfiguration configuration, ObservationExtractorRegistry extractors,
        Executor executor, Clock clock, Supplier<String> reportIds) {

        this.configuration = Objects.requireNonNull(configuration, "configuration");
        this.extractors = Objects.requireNonNull(extractors, "extractors");
        this.clock = clock != null ? clock : Clock.systemUTC();
        this.reportIds = reportIds != null ? reportIds : new ReportIdGenerator(this.clock);
        this.classifier = new ReportTypeClassifier(configuration.heuristics(), configuration.thresholds().typeDetection());
        this.extraction = new BoundedObservationExtraction(executor, configuration.extractionTimeout(),
            new ExtractionResponseParser());
        this.normalizer = new UnitNormalizer(configuration.conversions(), configuration.canonicalUnits());
        this.validator = ObservationValidator.withDefaultChecks(configuration.numericUnits());
        this.interpreter = new ClinicalInterpreter(configuration.analyteRules(), configuration.interpreterTexts());
    }

    public PipelineResult interpret(ReportSubmission submission) {
        ReportSubmission safeSubmission = submission != null ? submission : ReportSubmission.of(null, null);
        Run run = new Run(reportIds.get(), clock.instant(), SourceFormat.fromHint(safeSubmission.sourceFormatHint()),
            safeSubmission.pseudoId());

        try (PipelineMdc.Context ignored = PipelineMdc.open(run.reportId)) {
            try {
                return execute(safeSubmission.reportText(), run);
            } catch (RuntimeException ex) {
                LOGGER.error("Unexpected failure while processing report {} at stage {}", run.reportId,
                    run.stage.mdcValue(), ex);
                return discard(run, DiscardReason.SYSTEM_ERROR,
                    "unexpected " + ex.getClass().getSimpleName() + " during " + run.stage.mdcValue());
            }
        }
    }

    public Set<ReportType> supportedTypes() {
        return extractors.supportedTypes();
    }

    public PipelineConfiguration configuration() {
        return configuration;
    }

    private PipelineResult execute(ReportText reportText, Run run) {
        PipelineThresholds thresholds = configuration.thresholds();
        enter(run, PipelineStage.INGESTED);
        LOGGER.info("Processing report ({} characters, quality {}, source format {})", reportText.text().length(),
            reportText.qualityScore(), run.sourceFormat);

        if (reportText.qualityScore() < thresholds.qualityFloor()) {
            return discard(run, DiscardReason.LOW_QUALITY_INPUT,
                format("OCR quality %.2f below floor %.2f", reportText.qualityScore(), thresholds.qualityFloor()));
        }

        if (interrupted()) {
            return discard(run, DiscardReason.SYSTEM_ERROR, "interrupted before classification");
        }
        TypeDetection detection = classifier.classify(reportText);
        run.detection = detection;
        enter(run, PipelineStage.CLASSIFIED);
        if (detection.label() == ReportType.OTHER) {
            return discard(run, DiscardReason.UNRECOGNIZED_TYPE,
                format("type confidence %.2f below minimum %.2f (%s)", detection.confidence(),
                    thresholds.typeDetection(), detection.rationale()));
        }
        Optional<ObservationExtractor> extractor = extractors.find(detection.label());
        if (extractor.isEmpty()) {
            return discard(run, DiscardReason.UNSUPPORTED_TYPE,
                "no extractor available for report type " + detection.label().label());
        }

        if (interrupted()) {
            return discard(run, DiscardReason.SYSTEM_ERROR, "interrupted before extraction");
        }
        ExtractionOutcome extracted = extraction.extract(extractor.get(),
            new ExtractionRequest(reportText.text(), detection.label()));
        run.extractionConfidence = extracted.confidence();
        enter(run, PipelineStage.EXTRACTED);
        if (interrupted()) {
            return discard(run, DiscardReason.SYSTEM_ERROR, "interrupted during extraction");
        }
        if (extracted.data().isEmpty() || extracted.confidence() < thresholds.extractionMin()) {
            String detail = format("extraction confidence %.2f below minimum %.2f with %d observations",
                extracted.confidence(), thresholds.extractionMin(), extracted.data().size());
            return discard(run, DiscardReason.LOW_EXTRACTION_CONFIDENCE,
                extracted.isFailure() ? detail + " (" + extracted.failure() + ")" : detail);
        }

        NormalizationOutcome normalized = normalizer.normalize(extracted.data());
        run.normalizationConfidence = normalized.confidence();
        run.conversions.addAll(normalized.conversions());
        enter(run, PipelineStage.NORMALIZED);
        if (normalized.confidence() < thresholds.normalizationMin()) {
            return discard(run, DiscardReason.LOW_NORMALIZATION_CONFIDENCE,
                format("normalization confidence %.2f below minimum %.2f", normalized.confidence(),
                    thresholds.normalizationMin()) + "; " + String.join("; ", normalized.failures()));
        }

        if (interrupted()) {
            return discard(run, DiscardReason.SYSTEM_ERROR, "interrupted before validation");
        }
        List<ValidationFinding> findings = validator.validate(normalized.data(), run.ingestedAt);
        findings.forEach(finding -> run.findings.add(describe(finding)));
        enter(run, PipelineStage.VALIDATED);
        long failures = findings.stream().filter(ValidationFinding::isFailure).count();
        if (failures > 0) {
            return discard(run, DiscardReason.VALIDATION_FAILURE, failures + " validation check(s) failed");
        }

        if (interrupted()) {
            return discard(run, DiscardReason.SYSTEM_ERROR, "interrupted before interpretation");
        }
        InterpretationOutcome interpretation = interpreter.interpret(normalized.data());
        run.rulesTriggered.addAll(interpretation.rulesTriggered());
        enter(run, PipelineStage.INTERPRETED);

        double overall = run.overallConfidence();
        if (overall < thresholds.overallAcceptMin()) {
            return discard(run, DiscardReason.LOW_OVERALL_CONFIDENCE,
                format("overall confidence %.2f below minimum %.2f", overall, thresholds.overallAcceptMin()));
        }

        enter(run, PipelineStage.ACCEPTED);
        LOGGER.info("Accepted report as {} with category {} (overall confidence {})", detection.label(),
            interpretation.interpretation().category(), overall);
        return new PipelineResult(run.reportId, detection.label(), run.sourceFormat, run.ingestedAt,
            PatientInfo.pseudonymous(run.pseudoId), normalized.data(), interpretation.interpretation(), run.audit(),
            configuration.references(), ReportStatus.ACCEPTED, null);
    }

    private PipelineResult discard(Run run, DiscardReason reason, String detail) {
        PipelineStage gate = run.stage;
        run.findings.add("discarded at " + gate.mdcValue() + " (" + reason.templateKey() + "): " + detail);
        enter(run, PipelineStage.DISCARDED);
        if (reason == DiscardReason.SYSTEM_ERROR) {
            LOGGER.warn("Discarded report at stage {} with reason {}: {}", gate.mdcValue(), reason, detail);
        } else {
            LOGGER.info("Discarded report at stage {} with reason {}: {}", gate.mdcValue(), reason, detail);
        }
        return new PipelineResult(run.reportId, ReportType.OTHER, run.sourceFormat, run.ingestedAt,
            PatientInfo.pseudonymous(run.pseudoId), null, null, run.audit(), List.of(), ReportStatus.DISCARDED,
            configuration.feedback().messageFor(reason));
    }

    private static void enter(Run run, PipelineStage stage) {
        run.stage = stage;
        PipelineMdc.setStage(stage);
    }

    private static boolean interrupted() {
        return Thread.currentThread().isInterrupted();
    }

    private static String describe(ValidationFinding finding) {
        return finding.outcome().value() + ": " + finding.message();
    }

    private static String format(String pattern, Object... arguments) {
        return String.format(Locale.ROOT, pattern, arguments);
    }

    /**
     * Audit state accumulated by a single run. Confined to the calling thread.
     */
    private static final class Run {

        private final String reportId;
        private final Instant ingestedAt;
        private final SourceFormat sourceFormat;
        private final String pseudoId;
        private PipelineStage stage = PipelineStage.INGESTED;
        private TypeDetection detection = TypeDetection.none();
        private double extractionConfidence;
        private double normalizationConfidence;
        private final List<String> rulesTriggered = new ArrayList<>();
        private final List<UnitConversionRecord> conversions = new ArrayList<>();
        private final List<String> findings = new ArrayList<>();

        private Run(String reportId, Instant ingestedAt, SourceFormat sourceFormat, String pseudoId) {
            this.reportId = reportId;
            this.ingestedAt = ingestedAt;
            this.sourceFormat = sourceFormat;
            this.pseudoId = pseudoId;
        }

        private double overallConfidence() {
            return AuditTrail.overall(detection.confidence(), extractionConfidence, normalizationConfidence);
        }

        private AuditTrail audit() {
            return new AuditTrail(detection, extractionConfidence, normalizationConfidence, overallConfidence(),
                rulesTriggered, conversions, findings);
        }
    }
}
