package dev.pekelund.medinterp.reportservice;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.cloud.firestore.Firestore;
import com.google.cloud.firestore.FirestoreOptions;
import dev.pekelund.medinterp.extraction.ObservationExtractorRegistry;
import dev.pekelund.medinterp.model.ReportType;
import dev.pekelund.medinterp.pipeline.PipelineConfiguration;
import dev.pekelund.medinterp.pipeline.ReportInterpretationPipeline;
import dev.pekelund.medinterp.reportservice.googleai.GeminiClient;
import dev.pekelund.medinterp.reportservice.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.medinterp.reportservice.googleai.GoogleAiGeminiClient;
import io.micrometer.observation.ObservationRegistry;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Service configuration for the report interpretation workload.
 */
@Configuration
@EnableConfigurationProperties(InterpreterProperties.class)
public class ReportServiceConfiguration {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportServiceConfiguration.class);

    @Bean
    public ObjectMapper objectMapper(Jackson2ObjectMapperBuilder jacksonObjectMapperBuilder) {
        return jacksonObjectMapperBuilder
            .featuresToDisable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();
    }

    @Bean
    public GoogleAiGeminiChatOptions geminiChatOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", "gemini-2.0-flash");
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        Double frequencyPenalty = environment.getProperty("google.ai.gemini.frequency-penalty", Double.class);
        Double presencePenalty = environment.getProperty("google.ai.gemini.presence-penalty", Double.class);
        List<String> stopSequences = stopSequences(environment, "google.ai.gemini.stop-sequences");
        LOGGER.info("Configured Google AI Gemini settings - model: {}, temperature: {}, topP: {}, topK: {}, "
            + "maxOutputTokens: {}, frequencyPenalty: {}, presencePenalty: {}, stopSequences: {}", modelName,
            temperature, topP, topK, maxOutputTokens, frequencyPenalty, presencePenalty, stopSequences);
        return GoogleAiGeminiChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .frequencyPenalty(frequencyPenalty)
            .presencePenalty(presencePenalty)
            .stopSequences(stopSequences)
            .build();
    }

    /**
     * Per-call overrides for observation extraction, merged over {@link #geminiChatOptions} by the client.
     * JSON output is always requested.
     */
    @Bean
    public GoogleAiGeminiChatOptions extractionGeminiChatOptions(Environment environment) {
        GoogleAiGeminiChatOptions overrides = GoogleAiGeminiChatOptions.builder()
            .model(environment.getProperty("google.ai.gemini.extraction.model"))
            .temperature(environment.getProperty("google.ai.gemini.extraction.temperature", Double.class, 0.0))
            .maxOutputTokens(environment.getProperty("google.ai.gemini.extraction.max-output-tokens", Integer.class))
            .stopSequences(stopSequences(environment, "google.ai.gemini.extraction.stop-sequences"))
            .responseMimeType(GoogleAiGeminiChatOptions.JSON_MIME_TYPE)
            .build();
        LOGGER.info("Configured Gemini extraction overrides: {}", overrides);
        return overrides;
    }

    @Bean
    public GeminiClient geminiClient(Environment environment,
        @Qualifier("geminiChatOptions") GoogleAiGeminiChatOptions geminiChatOptions,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty("AI_STUDIO_API_KEY");
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalStateException("Google AI Studio API key must be configured (AI_STUDIO_API_KEY)");
        }
        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();
        return new GoogleAiGeminiClient(restClient, apiKey, geminiChatOptions,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }

    @Bean
    public GeminiObservationExtractor geminiObservationExtractor(GeminiClient geminiClient,
        @Qualifier("extractionGeminiChatOptions") GoogleAiGeminiChatOptions extractionGeminiChatOptions) {
        return new GeminiObservationExtractor(geminiClient, extractionGeminiChatOptions);
    }

    @Bean
    public ObservationExtractorRegistry observationExtractorRegistry(
        GeminiObservationExtractor geminiObservationExtractor) {
        return ObservationExtractorRegistry.of(ReportType.OBSERVATION_LABS, geminiObservationExtractor);
    }

    @Bean
    public PipelineConfiguration pipelineConfiguration(InterpreterProperties interpreterProperties) {
        return interpreterProperties.toPipelineConfiguration();
    }

    @Bean
    public ThreadPoolTaskExecutor extractionExecutor(InterpreterProperties interpreterProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(interpreterProperties.getExtractionThreads());
        executor.setMaxPoolSize(interpreterProperties.getExtractionThreads());
        executor.setQueueCapacity(interpreterProperties.getExtractionThreads() * 10);
        executor.setThreadNamePrefix("report-extraction-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }

    @Bean
    public ReportInterpretationPipeline reportInterpretationPipeline(PipelineConfiguration pipelineConfiguration,
        ObservationExtractorRegistry observationExtractorRegistry, ThreadPoolTaskExecutor extractionExecutor) {
        return new ReportInterpretationPipeline(pipelineConfiguration, observationExtractorRegistry,
            extractionExecutor);
    }

    @Bean
    @ConditionalOnProperty(prefix = "interpreter.persistence", name = "enabled", havingValue = "true")
    public ReportServiceSettings reportServiceSettings() {
        return ReportServiceSettings.fromEnvironment();
    }

    @Bean
    @ConditionalOnProperty(prefix = "interpreter.persistence", name = "enabled", havingValue = "true")
    public Firestore firestore(ReportServiceSettings reportServiceSettings) {
        FirestoreOptions.Builder optionsBuilder = FirestoreOptions.getDefaultInstance().toBuilder()
            .setProjectId(reportServiceSettings.projectId());
        if (StringUtils.hasText(reportServiceSettings.databaseId())) {
            optionsBuilder.setDatabaseId(reportServiceSettings.databaseId());
        }
        Firestore firestore = optionsBuilder.build().getService();
        LOGGER.info("Initialized Firestore client for project '{}' (target collection '{}')",
            firestore.getOptions().getProjectId(), reportServiceSettings.resultsCollection());
        return firestore;
    }

    @Bean
    public InterpretationResultSink interpretationResultSink(ObjectProvider<Firestore> firestore,
        ObjectProvider<ReportServiceSettings> reportServiceSettings, ObjectMapper objectMapper) {
        Firestore client = firestore.getIfAvailable();
        ReportServiceSettings settings = reportServiceSettings.getIfAvailable();
        if (client == null || settings == null) {
            LOGGER.info("Result persistence disabled; accepted reports will not be stored");
            return new NoopInterpretationResultSink();
        }
        return new InterpretationResultRepository(client, settings.resultsCollection(), objectMapper);
    }

    @Bean
    public ReportTextReader reportTextReader() {
        return new ReportTextReader();
    }

    @Bean
    public ReportInterpretationService reportInterpretationService(ReportInterpretationPipeline pipeline,
        InterpretationResultSink interpretationResultSink) {
        return new ReportInterpretationService(pipeline, interpretationResultSink);
    }

    private static List<String> stopSequences(Environment environment, String property) {
        return Binder.get(environment).bind(property, Bindable.listOf(String.class)).orElse(List.of());
    }
}
