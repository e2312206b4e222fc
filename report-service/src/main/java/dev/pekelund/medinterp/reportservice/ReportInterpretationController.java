package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.model.PipelineResult;
import dev.pekelund.medinterp.model.ReportText;
import dev.pekelund.medinterp.model.ReportType;
import dev.pekelund.medinterp.pipeline.ReportSubmission;
import java.io.IOException;
import java.util.Collection;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

/**
 * REST API for interpreting medical reports. Accepted and discarded results are both returned
 * with status 200; the result's own status tells them apart.
 */
@RestController
@RequestMapping(path = "/api/reports")
public class ReportInterpretationController {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportInterpretationController.class);

    private final ReportInterpretationService interpretationService;
    private final ReportTextReader reportTextReader;

    public ReportInterpretationController(ReportInterpretationService interpretationService,
        ReportTextReader reportTextReader) {
        this.interpretationService = interpretationService;
        this.reportTextReader = reportTextReader;
    }

    @GetMapping(path = "/types", produces = MediaType.APPLICATION_JSON_VALUE)
    public Collection<ReportType> supportedTypes() {
        return interpretationService.supportedTypes();
    }

    @PostMapping(path = "/interpret", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public PipelineResult interpret(@RequestBody InterpretRequest request) {
        if (request == null || !StringUtils.hasText(request.pseudoId())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "A pseudoId must be provided");
        }
        if (!StringUtils.hasText(request.text()) || request.qualityScore() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "Report text and its qualityScore must be provided");
        }
        ReportText reportText = request.confidence() != null
            ? new ReportText(request.text(), request.qualityScore(), request.confidence())
            : new ReportText(request.text(), request.qualityScore());
        LOGGER.info("Interpreting submitted report text ({} characters)", request.text().length());
        return interpretationService.interpret(new ReportSubmission(reportText, request.pseudoId(),
            request.sourceFormatHint(), request.userRegion(), Boolean.TRUE.equals(request.preserveHighRes())));
    }

    @PostMapping(path = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public PipelineResult upload(@RequestPart("file") MultipartFile file,
        @RequestParam(name = "pseudoId", required = false) String pseudoId,
        @RequestParam(name = "sourceFormatHint", required = false) String sourceFormatHint,
        @RequestParam(name = "userRegion", required = false) String userRegion,
        @RequestParam(name = "preserveHighRes", defaultValue = "false") boolean preserveHighRes) throws IOException {

        if (!StringUtils.hasText(pseudoId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "A pseudoId must be provided");
        }
        if (file == null || file.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST,
                "A non-empty report must be provided as the 'file' part");
        }
        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : "report";
        LOGGER.info("Reading uploaded report '{}' ({} bytes, {})", fileName, file.getSize(), file.getContentType());
        ReportText reportText = reportTextReader.read(file.getBytes(), fileName, file.getContentType());
        return interpretationService.interpret(new ReportSubmission(reportText, pseudoId, sourceFormatHint,
            userRegion, preserveHighRes));
    }

    @ExceptionHandler(ReportReadException.class)
    @ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
    public Map<String, Object> handleReadException(ReportReadException exception) {
        LOGGER.warn("Uploaded report could not be read: {}", exception.getMessage());
        return Map.of("error", exception.getMessage());
    }

    public record InterpretRequest(String text, Double qualityScore, Double confidence, String pseudoId,
        String sourceFormatHint, String userRegion, Boolean preserveHighRes) { }
}
