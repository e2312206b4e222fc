package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.extraction.ExtractionRequest;
import dev.pekelund.medinterp.extraction.ObservationExtractor;
import dev.pekelund.medinterp.reportservice.googleai.GeminiClient;
import dev.pekelund.medinterp.reportservice.googleai.GoogleAiGeminiChatOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Asks Gemini to turn lab report text into the observation JSON the core parser understands.
 * The response is returned as text; parsing and scoring stay in the pipeline. The options given here
 * are per-call overrides applied on top of the client's defaults.
 */
public class GeminiObservationExtractor implements ObservationExtractor {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiObservationExtractor.class);

    private static final String FORMAT_INSTRUCTIONS = """
        Return a JSON object with the following structure:
        {
          "panelName": string|null,
          "observations": [
            {
              "code": string|null (short analyte code such as "LDL" or "HbA1c"),
              "display": string|null (analyte name as printed),
              "value": number|string|null,
              "unit": string|null (exactly as printed, e.g. "mg/dL"),
              "referenceRange": {"low": number|null, "high": number|null, "unit": string|null}|null,
              "collectedAt": string|null (ISO-8601 date or date-time),
              "flags": [string]
            }
          ]
        }
        Report only values that are printed in the document; never compute or guess values or units.
        Use a number for "value" whenever the printed result is numeric and a dot (.) as decimal separator.
        Use null for unknown values. Do not add code fences or commentary; return only the JSON document.
        """;

    private final GeminiClient geminiClient;
    private final GoogleAiGeminiChatOptions chatOptions;

    public GeminiObservationExtractor(GeminiClient geminiClient, GoogleAiGeminiChatOptions chatOptions) {
        this.geminiClient = geminiClient;
        this.chatOptions = chatOptions;
    }

    @Override
    public String extract(ExtractionRequest request) {
        if (request == null || !StringUtils.hasText(request.text())) {
            throw new ObservationExtractionException("Cannot extract observations from an empty report");
        }
        String prompt = buildPrompt(request);
        LOGGER.info("Requesting {} extraction from model '{}' with prompt length {} characters",
            request.reportType(), effectiveModel(), prompt.length());

        String response;
        try {
            response = geminiClient.generateContent(prompt, chatOptions);
        } catch (IllegalStateException ex) {
            throw new ObservationExtractionException("Gemini extraction call failed", ex);
        }
        if (!StringUtils.hasText(response)) {
            throw new ObservationExtractionException("Gemini returned an empty response");
        }
        LOGGER.debug("Gemini raw response: {}", preview(response));
        return sanitiseResponse(response);
    }

    static String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                LOGGER.info("Removing Markdown code fences (language '{}') from Gemini response",
                    trimmed.substring(3, firstBreak).trim());
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            LOGGER.info("Removing single backtick fences from Gemini response");
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }

    private String buildPrompt(ExtractionRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert system that extracts laboratory results from medical reports.\n");
        prompt.append("The report was classified as ").append(request.reportType().label())
            .append(" and its text is provided between <report> tags.\n");
        prompt.append("Extract every measured analyte using the following structured output instructions.\n");
        prompt.append(FORMAT_INSTRUCTIONS).append('\n');
        prompt.append("<report>\n");
        prompt.append(request.text());
        prompt.append("\n</report>");
        return prompt.toString();
    }

    private String effectiveModel() {
        GoogleAiGeminiChatOptions defaults = geminiClient.getDefaultOptions();
        return defaults != null ? defaults.merge(chatOptions).getModel() : chatOptions.getModel();
    }

    private static String preview(String response) {
        int max = Math.min(response.length(), 256);
        return response.substring(0, max);
    }
}
