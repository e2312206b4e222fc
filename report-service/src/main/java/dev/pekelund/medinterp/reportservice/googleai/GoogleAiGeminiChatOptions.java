package dev.pekelund.medinterp.reportservice.googleai;

import java.util.List;
import java.util.Objects;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Generation settings sent with each Gemini call. {@code maxTokens} and {@code maxOutputTokens} are
 * the same setting; Gemini only knows the latter.
 */
public class GoogleAiGeminiChatOptions implements ChatOptions {

    public static final String JSON_MIME_TYPE = "application/json";

    private final String model;
    private final Double temperature;
    private final Double topP;
    private final Integer topK;
    private final Integer maxOutputTokens;
    private final Double frequencyPenalty;
    private final Double presencePenalty;
    private final List<String> stopSequences;
    private final String responseMimeType;

    private GoogleAiGeminiChatOptions(Builder builder) {
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.topP = builder.topP;
        this.topK = builder.topK;
        this.maxOutputTokens = builder.maxOutputTokens;
        this.frequencyPenalty = builder.frequencyPenalty;
        this.presencePenalty = builder.presencePenalty;
        this.stopSequences = builder.stopSequences == null ? List.of() : List.copyOf(builder.stopSequences);
        this.responseMimeType = builder.responseMimeType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
            .model(model)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .frequencyPenalty(frequencyPenalty)
            .presencePenalty(presencePenalty)
            .stopSequences(stopSequences)
            .responseMimeType(responseMimeType);
    }

    /**
     * Returns these options with every value set in {@code overrides} taking precedence.
     */
    public GoogleAiGeminiChatOptions merge(GoogleAiGeminiChatOptions overrides) {
        if (overrides == null) {
            return this;
        }
        return builder()
            .model(StringUtils.hasText(overrides.model) ? overrides.model : model)
            .temperature(firstNonNull(overrides.temperature, temperature))
            .topP(firstNonNull(overrides.topP, topP))
            .topK(firstNonNull(overrides.topK, topK))
            .maxOutputTokens(firstNonNull(overrides.maxOutputTokens, maxOutputTokens))
            .frequencyPenalty(firstNonNull(overrides.frequencyPenalty, frequencyPenalty))
            .presencePenalty(firstNonNull(overrides.presencePenalty, presencePenalty))
            .stopSequences(CollectionUtils.isEmpty(overrides.stopSequences) ? stopSequences : overrides.stopSequences)
            .responseMimeType(StringUtils.hasText(overrides.responseMimeType) ? overrides.responseMimeType
                : responseMimeType)
            .build();
    }

    private static <T> T firstNonNull(T preferred, T fallback) {
        return preferred != null ? preferred : fallback;
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public Double getTemperature() {
        return temperature;
    }

    @Override
    public Double getTopP() {
        return topP;
    }

    @Override
    public Integer getTopK() {
        return topK;
    }

    @Override
    public Integer getMaxTokens() {
        return maxOutputTokens;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    @Override
    public Double getFrequencyPenalty() {
        return frequencyPenalty;
    }

    @Override
    public Double getPresencePenalty() {
        return presencePenalty;
    }

    @Override
    public List<String> getStopSequences() {
        return stopSequences;
    }

    public String getResponseMimeType() {
        return responseMimeType;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends ChatOptions> T copy() {
        return (T) toBuilder().build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GoogleAiGeminiChatOptions that)) {
            return false;
        }
        return Objects.equals(model, that.model)
            && Objects.equals(temperature, that.temperature)
            && Objects.equals(topP, that.topP)
            && Objects.equals(topK, that.topK)
            && Objects.equals(maxOutputTokens, that.maxOutputTokens)
            && Objects.equals(frequencyPenalty, that.frequencyPenalty)
            && Objects.equals(presencePenalty, that.presencePenalty)
            && Objects.equals(stopSequences, that.stopSequences)
            && Objects.equals(responseMimeType, that.responseMimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, temperature, topP, topK, maxOutputTokens, frequencyPenalty, presencePenalty,
            stopSequences, responseMimeType);
    }

    @Override
    public String toString() {
        return "GoogleAiGeminiChatOptions{"
            + "model='" + model + '\''
            + ", temperature=" + temperature
            + ", topP=" + topP
            + ", topK=" + topK
            + ", maxOutputTokens=" + maxOutputTokens
            + ", responseMimeType=" + responseMimeType
            + '}';
    }

    public static class Builder implements ChatOptions.Builder {

        private String model;
        private Double temperature;
        private Double topP;
        private Integer topK;
        private Integer maxOutputTokens;
        private Double frequencyPenalty;
        private Double presencePenalty;
        private List<String> stopSequences;
        private String responseMimeType;

        @Override
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        @Override
        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        @Override
        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        @Override
        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        @Override
        public Builder maxTokens(Integer maxTokens) {
            this.maxOutputTokens = maxTokens;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        @Override
        public Builder frequencyPenalty(Double frequencyPenalty) {
            this.frequencyPenalty = frequencyPenalty;
            return this;
        }

        @Override
        public Builder presencePenalty(Double presencePenalty) {
            this.presencePenalty = presencePenalty;
            return this;
        }

        @Override
        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            this.responseMimeType = responseMimeType;
            return this;
        }

        @Override
        public GoogleAiGeminiChatOptions build() {
            return new GoogleAiGeminiChatOptions(this);
        }
    }
}
