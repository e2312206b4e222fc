package dev.pekelund.medinterp.reportservice;

import dev.pekelund.medinterp.pipeline.PipelineConfiguration;
import dev.pekelund.medinterp.pipeline.ReportInterpretationPipeline;
import dev.pekelund.medinterp.reportservice.googleai.GeminiClient;
import java.util.Arrays;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Logs the resolved pipeline and model configuration when the service boots.
 */
@Component
public class ReportServiceDiagnostics implements ApplicationRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ReportServiceDiagnostics.class);

    private final Environment environment;
    private final ObjectProvider<ReportInterpretationPipeline> pipelineProvider;
    private final ObjectProvider<GeminiClient> geminiClientProvider;

    public ReportServiceDiagnostics(Environment environment,
        ObjectProvider<ReportInterpretationPipeline> pipelineProvider,
        ObjectProvider<GeminiClient> geminiClientProvider) {
        this.environment = environment;
        this.pipelineProvider = pipelineProvider;
        this.geminiClientProvider = geminiClientProvider;
    }

    @Override
    public void run(ApplicationArguments args) {
        LOGGER.info("Report interpreter diagnostics starting");
        LOGGER.info("Active Spring profiles: {}", Arrays.toString(environment.getActiveProfiles()));
        LOGGER.info("Result persistence enabled: {}",
            environment.getProperty("interpreter.persistence.enabled", Boolean.class, false));

        ReportInterpretationPipeline pipeline = pipelineProvider.getIfAvailable();
        if (pipeline != null) {
            PipelineConfiguration configuration = pipeline.configuration();
            LOGGER.info("Pipeline thresholds: {}", configuration.thresholds());
            LOGGER.info("Extraction timeout {} with {} heuristics, {} unit conversions and {} analyte rules",
                configuration.extractionTimeout(), configuration.heuristics().size(),
                configuration.conversions().size(), configuration.analyteRules().size());
            LOGGER.info("Report types with an extractor: {}", pipeline.supportedTypes());
        } else {
            LOGGER.info("Pipeline bean not available; skipping pipeline diagnostics");
        }

        GeminiClient geminiClient = geminiClientProvider.getIfAvailable();
        if (geminiClient != null) {
            LOGGER.info("Gemini client implementation: {} - default options: {}", geminiClient.getClass().getName(),
                geminiClient.getDefaultOptions());
        } else {
            LOGGER.info("Gemini client bean not available; skipping client diagnostics");
        }
    }
}
