package dev.pekelund.medinterp.reportservice.googleai;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationRegistry;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * {@link GeminiClient} calling the {@code generateContent} REST endpoint with an API key.
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GoogleAiGeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, String apiKey, GoogleAiGeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null ? defaultOptions : GoogleAiGeminiChatOptions.builder().build();
        this.observationRegistry = observationRegistry != null ? observationRegistry : ObservationRegistry.NOOP;
    }

    @Override
    public GoogleAiGeminiChatOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String generateContent(String prompt, GoogleAiGeminiChatOptions overrides) {
        if (!StringUtils.hasText(prompt)) {
            throw new IllegalArgumentException("Prompt must not be empty");
        }
        GoogleAiGeminiChatOptions options = defaultOptions.merge(overrides);
        String model = options.getModel();
        if (!StringUtils.hasText(model)) {
            throw new IllegalStateException("Gemini model name must be configured");
        }

        Observation observation = Observation.start("medinterp.gemini.generate", observationRegistry)
            .lowCardinalityKeyValue("model", model)
            .highCardinalityKeyValue("prompt.length", String.valueOf(prompt.length()));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.info("Calling Gemini model '{}' with prompt length {} (response type {})", model, prompt.length(),
                Optional.ofNullable(options.getResponseMimeType()).orElse("text/plain"));
            GenerateContentResponse response = post(model, toRequest(prompt, options));
            return firstText(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private GenerateContentRequest toRequest(String prompt, GoogleAiGeminiChatOptions options) {
        GenerateContentRequest.GenerationConfig config = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxOutputTokens(),
            options.getFrequencyPenalty(), options.getPresencePenalty(),
            CollectionUtils.isEmpty(options.getStopSequences()) ? null : options.getStopSequences(),
            options.getResponseMimeType());
        return new GenerateContentRequest(
            List.of(new GenerateContentRequest.Content("user", List.of(new GenerateContentRequest.Part(prompt)))),
            config);
    }

    private GenerateContentResponse post(String model, GenerateContentRequest request) {
        try {
            return restClient.post()
                .uri(uriBuilder -> uriBuilder
                    .path("/models/{model}:generateContent")
                    .queryParam("key", apiKey)
                    .build(model))
                .body(request)
                .retrieve()
                .body(GenerateContentResponse.class);
        } catch (RestClientException ex) {
            throw new IllegalStateException("Gemini request for model '" + model + "' failed", ex);
        }
    }

    private String firstText(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new IllegalStateException("Gemini response did not contain any candidates");
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null
                && candidate.content().parts() != null)
            .flatMap(candidate -> candidate.content().parts().stream())
            .filter(part -> part != null && StringUtils.hasText(part.text()))
            .map(GenerateContentResponse.Part::text)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("Gemini response did not contain any text parts"));
    }

    record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        record Content(String role, List<Part> parts) {
        }

        record Part(String text) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
            Double frequencyPenalty, Double presencePenalty, List<String> stopSequences, String responseMimeType) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record GenerateContentResponse(List<Candidate> candidates) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        record Candidate(Content content, String finishReason) {
        }

        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }
    }
}
