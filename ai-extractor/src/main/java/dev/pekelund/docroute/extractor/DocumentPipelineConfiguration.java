package dev.pekelund.docroute.extractor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docroute.ai.AiExtractionClient;
import dev.pekelund.docroute.analysis.ColumnAlignmentSignalProvider;
import dev.pekelund.docroute.analysis.PageComplexityAnalyzer;
import dev.pekelund.docroute.extractor.googleai.GeminiPageExtractionClient;
import dev.pekelund.docroute.extractor.googleai.GoogleAiGeminiChatOptions;
import dev.pekelund.docroute.extractor.googleai.GoogleAiGeminiClient;
import dev.pekelund.docroute.numbers.NumberExtractor;
import dev.pekelund.docroute.pipeline.DocumentFailoverPipeline;
import dev.pekelund.docroute.pipeline.DocumentResultJsonWriter;
import dev.pekelund.docroute.pipeline.PipelineSettings;
import dev.pekelund.docroute.reconstruct.ResultReconstructor;
import dev.pekelund.docroute.routing.AiFailoverRouter;
import dev.pekelund.docroute.source.DocumentOpener;
import dev.pekelund.docroute.source.PdfBoxDocumentOpener;
import dev.pekelund.docroute.tables.GeometricTableDetector;
import io.micrometer.observation.ObservationRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

/**
 * Wires the document failover pipeline with the Gemini extraction client.
 */
@Configuration
public class DocumentPipelineConfiguration {

    static final String API_KEY_PROPERTY = "AI_STUDIO_API_KEY";

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentPipelineConfiguration.class);

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    @Bean
    public PipelineSettings pipelineSettings() {
        return DocumentPipelineSettings.fromEnvironment();
    }

    @Bean
    public GoogleAiGeminiChatOptions documentGeminiChatOptions(Environment environment) {
        String modelName = environment.getProperty("google.ai.gemini.model", GoogleAiGeminiChatOptions.DEFAULT_MODEL);
        Double temperature = environment.getProperty("google.ai.gemini.temperature", Double.class);
        Double topP = environment.getProperty("google.ai.gemini.top-p", Double.class);
        Integer topK = environment.getProperty("google.ai.gemini.top-k", Integer.class);
        Integer maxOutputTokens = environment.getProperty("google.ai.gemini.max-output-tokens", Integer.class);
        LOGGER.info("Configured Gemini settings - model: {}, temperature: {}, topP: {}, topK: {}, maxOutputTokens: {}",
            modelName, temperature, topP, topK, maxOutputTokens);
        return GoogleAiGeminiChatOptions.builder()
            .model(modelName)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .responseMimeType(GoogleAiGeminiChatOptions.JSON_MIME_TYPE)
            .build();
    }

    /**
     * Without an API key the pipeline still starts; every group then goes to the local fallback.
     */
    @Bean
    public AiExtractionClient aiExtractionClient(Environment environment, ObjectMapper objectMapper,
        GoogleAiGeminiChatOptions documentGeminiChatOptions, PipelineSettings pipelineSettings,
        ObjectProvider<ObservationRegistry> observationRegistry) {

        String apiKey = environment.getProperty(API_KEY_PROPERTY);
        if (!StringUtils.hasText(apiKey)) {
            LOGGER.warn("{} is not set; AI extraction is unavailable and pages use the local fallback",
                API_KEY_PROPERTY);
            return AiExtractionClient.disabled();
        }

        String baseUrl = environment.getProperty("google.ai.gemini.base-url", GoogleAiGeminiClient.DEFAULT_BASE_URL);
        RestClient restClient = RestClient.builder().baseUrl(baseUrl).build();
        GoogleAiGeminiClient geminiClient = new GoogleAiGeminiClient(restClient, apiKey, documentGeminiChatOptions,
            observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
        LOGGER.info("Gemini extraction client targets {} with options {}", baseUrl, geminiClient.getDefaultOptions());
        return new GeminiPageExtractionClient(geminiClient, objectMapper, documentGeminiChatOptions,
            pipelineSettings.failoverSettings().enabled(), pipelineSettings.failoverSettings().useVisionIfAvailable());
    }

    @Bean
    public DocumentOpener documentOpener() {
        return new PdfBoxDocumentOpener();
    }

    @Bean
    public DocumentFailoverPipeline documentFailoverPipeline(PipelineSettings pipelineSettings,
        AiExtractionClient aiExtractionClient, DocumentOpener documentOpener) {
        NumberExtractor numberExtractor = new NumberExtractor();
        ColumnAlignmentSignalProvider layoutSignals =
            new ColumnAlignmentSignalProvider(pipelineSettings.tableDetectionSettings().xTolerance());
        PageComplexityAnalyzer analyzer =
            new PageComplexityAnalyzer(pipelineSettings.analyzerThresholds(), numberExtractor, layoutSignals);
        AiFailoverRouter router =
            new AiFailoverRouter(aiExtractionClient, pipelineSettings.failoverSettings(), numberExtractor);
        GeometricTableDetector detector = new GeometricTableDetector(pipelineSettings.tableDetectionSettings());
        LOGGER.info("Document pipeline configured with {}", pipelineSettings);
        return new DocumentFailoverPipeline(analyzer, router, detector, new ResultReconstructor(), documentOpener);
    }

    @Bean
    public DocumentResultJsonWriter documentResultJsonWriter(ObjectMapper objectMapper) {
        return new DocumentResultJsonWriter(objectMapper);
    }
}
