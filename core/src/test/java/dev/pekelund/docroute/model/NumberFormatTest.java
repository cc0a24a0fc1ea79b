package dev.pekelund.docroute.model;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

class NumberFormatTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void resolvesLabelsAndConstantNamesIgnoringCase() {
        assertThat(NumberFormat.fromLabel("scientific_notation")).isEqualTo(NumberFormat.SCIENTIFIC_NOTATION);
        assertThat(NumberFormat.fromLabel("CURRENCY")).isEqualTo(NumberFormat.CURRENCY);
    }

    @Test
    void unknownLabelDeserializesAsNull() throws Exception {
        NumberMatch match = objectMapper.readValue("{\"value\": 0.5, \"original_text\": \"1/2\", \"format\": \"fraction\"}",
            NumberMatch.class);

        assertThat(match.format()).isNull();
        assertThat(match.originalText()).isEqualTo("1/2");
    }
}
