package dev.pekelund.docroute.extractor.googleai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;

import io.micrometer.observation.Observation;
import io.micrometer.observation.ObservationHandler;
import io.micrometer.observation.ObservationRegistry;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.ExpectedCount;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.test.web.client.match.MockRestRequestMatchers;
import org.springframework.test.web.client.response.MockRestResponseCreators;
import org.springframework.web.client.RestClient;

class GoogleAiGeminiClientTest {

    private static final String ENDPOINT = "http://localhost/models/gemini-2.0-flash:generateContent";

    private MockRestServiceServer server;
    private GoogleAiGeminiClient client;
    private final List<Observation.Context> stopped = new ArrayList<>();

    @BeforeEach
    void setUp() {
        RestClient.Builder restClientBuilder = RestClient.builder().baseUrl("http://localhost");
        server = MockRestServiceServer.bindTo(restClientBuilder).build();

        ObservationRegistry registry = ObservationRegistry.create();
        registry.observationConfig().observationHandler(new RecordingHandler(stopped));

        GoogleAiGeminiChatOptions defaults = GoogleAiGeminiChatOptions.builder()
            .model("gemini-2.0-flash")
            .temperature(0.2)
            .responseMimeType(GoogleAiGeminiChatOptions.JSON_MIME_TYPE)
            .build();
        client = new GoogleAiGeminiClient(restClientBuilder.build(), "test-key", defaults, registry);
    }

    @Test
    void postsPromptAndReturnsFirstTextPart() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo(startsWith(ENDPOINT)))
            .andExpect(MockRestRequestMatchers.method(HttpMethod.POST))
            .andExpect(MockRestRequestMatchers.queryParam("key", "test-key"))
            .andExpect(MockRestRequestMatchers.content().json("{"
                + "\"contents\":[{\"role\":\"user\",\"parts\":[{\"text\":\"Extract page 1\"}]}],"
                + "\"generationConfig\":{\"temperature\":0.2,\"topK\":40,\"responseMimeType\":\"application/json\"}}"))
            .andRespond(MockRestResponseCreators.withSuccess("{\"candidates\":[{\"content\":{\"parts\":["
                + "{\"text\":\"\"},{\"text\":\"{\\\"pages\\\":[]}\"}]}}],\"usageMetadata\":{\"totalTokenCount\":12}}",
                MediaType.APPLICATION_JSON));

        String reply = client.generateContent("Extract page 1", GoogleAiGeminiChatOptions.builder().topK(40).build());

        server.verify();
        assertThat(reply).isEqualTo("{\"pages\":[]}");
        assertThat(stopped).singleElement()
            .satisfies(context -> assertThat(context.getName()).isEqualTo(GoogleAiGeminiClient.OBSERVATION_NAME));
    }

    @Test
    void modelOverrideChangesEndpoint() {
        server.expect(ExpectedCount.once(),
                MockRestRequestMatchers.requestTo(startsWith("http://localhost/models/gemini-1.5-pro:generateContent")))
            .andRespond(MockRestResponseCreators.withSuccess(
                "{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"ok\"}]}}]}", MediaType.APPLICATION_JSON));

        String reply = client.generateContent("prompt",
            GoogleAiGeminiChatOptions.builder().model("gemini-1.5-pro").build());

        server.verify();
        assertThat(reply).isEqualTo("ok");
    }

    @Test
    void serverErrorIsReportedAsClientException() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo(startsWith(ENDPOINT)))
            .andRespond(MockRestResponseCreators.withServerError());

        assertThatThrownBy(() -> client.generateContent("prompt", null))
            .isInstanceOf(GeminiClientException.class)
            .hasMessageContaining("gemini-2.0-flash");
        assertThat(stopped).singleElement().satisfies(context -> assertThat(context.getError()).isNotNull());
    }

    @Test
    void replyWithoutCandidatesIsRejected() {
        server.expect(ExpectedCount.once(), MockRestRequestMatchers.requestTo(startsWith(ENDPOINT)))
            .andRespond(MockRestResponseCreators.withSuccess("{\"candidates\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.generateContent("prompt", null))
            .isInstanceOf(GeminiClientException.class)
            .hasMessageContaining("candidates");
    }

    @Test
    void blankPromptAndMissingKeyAreRejected() {
        assertThatThrownBy(() -> client.generateContent(" ", null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GoogleAiGeminiClient(RestClient.create(), "", null, null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void mergeKeepsDefaultsForUnsetOverrides() {
        GoogleAiGeminiChatOptions merged = client.getDefaultOptions()
            .merge(GoogleAiGeminiChatOptions.builder().maxOutputTokens(2048).build());

        assertThat(merged.getModel()).isEqualTo("gemini-2.0-flash");
        assertThat(merged.getTemperature()).isEqualTo(0.2);
        assertThat(merged.getMaxOutputTokens()).isEqualTo(2048);
        assertThat(client.getDefaultOptions().merge(null)).isSameAs(client.getDefaultOptions());
    }

    private record RecordingHandler(List<Observation.Context> stopped) implements ObservationHandler<Observation.Context> {

        @Override
        public void onStop(Observation.Context context) {
            stopped.add(context);
        }

        @Override
        public boolean supportsContext(Observation.Context context) {
            return true;
        }
    }
}
