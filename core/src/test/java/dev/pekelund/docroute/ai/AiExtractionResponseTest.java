package dev.pekelund.docroute.ai;

import static dev.pekelund.docroute.ModelFixtures.page;
import static dev.pekelund.docroute.ModelFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docroute.model.ProcessingSummary;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class AiExtractionResponseTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void normalizedSynthesizesMissingSummary() {
        AiExtractionResponse response = new AiExtractionResponse(List.of(table("p1_t1", 1)),
            Arrays.asList(page(1, "Total 1,200"), null), null);

        AiExtractionResponse normalized = response.normalized();

        assertThat(normalized.pages()).hasSize(1);
        assertThat(normalized.processingSummary().tablesExtracted()).isEqualTo(1);
        assertThat(normalized.processingSummary().textSections()).isEqualTo(1);
        assertThat(normalized.processingSummary().overallQualityScore())
            .isEqualTo(AiExtractionResponse.DEFAULT_QUALITY_SCORE);
        assertThat(normalized.processingSummary().processingErrors()).isEmpty();
    }

    @Test
    void normalizedKeepsProvidedSummary() {
        ProcessingSummary summary = new ProcessingSummary(3, 4, 5, 0.95, List.of("skipped footer"));

        AiExtractionResponse normalized = new AiExtractionResponse(null, null, summary).normalized();

        assertThat(normalized.tables()).isEmpty();
        assertThat(normalized.pages()).isEmpty();
        assertThat(normalized.processingSummary()).isEqualTo(summary);
    }

    @Test
    void missingFieldsParseIntoEmptyResponse() throws Exception {
        AiExtractionResponse parsed = objectMapper.readValue("{\"model_notes\": \"ignored\"}", AiExtractionResponse.class);

        assertThat(parsed.isEmpty()).isTrue();
        assertThat(parsed.normalized().processingSummary().tablesExtracted()).isZero();
    }

    @Test
    void parsesSnakeCasePagesAndSections() throws Exception {
        String json = """
            {
              "pages": [
                {"page_number": 2, "sections": [
                  {"section_id": "p2_s1", "section_type": "paragraph", "content": "Net income rose", "word_count": 3, "llm_ready": true}
                ]}
              ]
            }
            """;

        AiExtractionResponse parsed = objectMapper.readValue(json, AiExtractionResponse.class).normalized();

        assertThat(parsed.pages()).singleElement().satisfies(page -> {
            assertThat(page.pageNumber()).isEqualTo(2);
            assertThat(page.sections().get(0).content()).isEqualTo("Net income rose");
            assertThat(page.sections().get(0).numbers()).isEmpty();
        });
    }

    @Test
    void disabledClientIsNeverAvailable() {
        AiExtractionClient client = AiExtractionClient.disabled();

        assertThat(client.isAvailable()).isFalse();
        assertThat(client.supportsVision()).isFalse();
        assertThatThrownBy(() -> client.extract(List.of())).isInstanceOf(AiExtractionException.class);
    }
}
