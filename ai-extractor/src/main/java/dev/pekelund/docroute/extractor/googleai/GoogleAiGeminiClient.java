package dev.pekelund.docroute.extractor.googleai;

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
 * {@link GeminiClient} that calls the {@code generateContent} endpoint with an AI Studio API key.
 */
public class GoogleAiGeminiClient implements GeminiClient {

    public static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com/v1beta";
    public static final String OBSERVATION_NAME = "docroute.gemini.call";

    private static final Logger LOGGER = LoggerFactory.getLogger(GoogleAiGeminiClient.class);

    private final RestClient restClient;
    private final String apiKey;
    private final GoogleAiGeminiChatOptions defaultOptions;
    private final ObservationRegistry observationRegistry;

    public GoogleAiGeminiClient(RestClient restClient, String apiKey, GoogleAiGeminiChatOptions defaultOptions,
        ObservationRegistry observationRegistry) {
        if (!StringUtils.hasText(apiKey)) {
            throw new IllegalArgumentException("Gemini API key must not be empty");
        }
        this.restClient = restClient;
        this.apiKey = apiKey;
        this.defaultOptions = defaultOptions != null
            ? defaultOptions
            : GoogleAiGeminiChatOptions.builder().model(GoogleAiGeminiChatOptions.DEFAULT_MODEL).build();
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

        Observation observation = Observation.start(OBSERVATION_NAME, observationRegistry)
            .lowCardinalityKeyValue("model", Optional.ofNullable(model).orElse("(unset)"))
            .highCardinalityKeyValue("prompt.length", String.valueOf(prompt.length()));
        try (Observation.Scope scope = observation.openScope()) {
            LOGGER.debug("Calling Gemini model '{}' with prompt length {}", model, prompt.length());
            GenerateContentResponse response = post(model, buildRequest(prompt, options));
            return firstText(response);
        } catch (RuntimeException ex) {
            observation.error(ex);
            throw ex;
        } finally {
            observation.stop();
        }
    }

    private GenerateContentRequest buildRequest(String prompt, GoogleAiGeminiChatOptions options) {
        GenerateContentRequest.Content content = new GenerateContentRequest.Content("user",
            List.of(new GenerateContentRequest.Part(prompt)));
        GenerateContentRequest.GenerationConfig generationConfig = new GenerateContentRequest.GenerationConfig(
            options.getTemperature(), options.getTopP(), options.getTopK(), options.getMaxOutputTokens(),
            options.getResponseMimeType());
        return new GenerateContentRequest(List.of(content), generationConfig);
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
            throw new GeminiClientException("Gemini request for model '" + model + "' failed", ex);
        }
    }

    private String firstText(GenerateContentResponse response) {
        if (response == null || CollectionUtils.isEmpty(response.candidates())) {
            throw new GeminiClientException("Gemini response did not contain any candidates");
        }
        return response.candidates().stream()
            .filter(candidate -> candidate != null && candidate.content() != null)
            .flatMap(candidate -> {
                List<GenerateContentResponse.Part> parts = candidate.content().parts();
                return parts != null ? parts.stream() : List.<GenerateContentResponse.Part>of().stream();
            })
            .map(GenerateContentResponse.Part::text)
            .filter(StringUtils::hasText)
            .findFirst()
            .orElseThrow(() -> new GeminiClientException("Gemini response did not contain any text parts"));
    }

    record GenerateContentRequest(List<Content> contents, GenerationConfig generationConfig) {

        record Content(String role, List<Part> parts) {
        }

        record Part(String text) {
        }

        @JsonInclude(JsonInclude.Include.NON_NULL)
        record GenerationConfig(Double temperature, Double topP, Integer topK, Integer maxOutputTokens,
            String responseMimeType) {
        }
    }

    record GenerateContentResponse(List<Candidate> candidates) {

        record Candidate(Content content) {
        }

        record Content(List<Part> parts) {
        }

        record Part(String text) {
        }
    }
}
