package dev.pekelund.docroute.pipeline;

import static dev.pekelund.docroute.ModelFixtures.page;
import static dev.pekelund.docroute.ModelFixtures.table;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docroute.model.DocumentMetadata;
import dev.pekelund.docroute.model.DocumentResult;
import dev.pekelund.docroute.model.ProcessingSummary;
import dev.pekelund.docroute.numbers.NumberExtractor;
import dev.pekelund.docroute.model.Page;
import dev.pekelund.docroute.model.Section;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DocumentResultJsonWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DocumentResultJsonWriter writer = new DocumentResultJsonWriter();

    @Test
    void rendersResultUnderRootKeyInSnakeCase() throws Exception {
        String text = "Revenue $1,500.00 grew 12%";
        Page numericPage = new Page(1, List.of(Section.paragraph(1, text, text, new NumberExtractor().extract(text))));
        DocumentResult result = new DocumentResult(
            new DocumentMetadata("q3.pdf", 2, List.of("ai_failover_routing")),
            new DocumentResult.Tables(List.of(table("p1_t1", 1))),
            new DocumentResult.TextContent(List.of(numericPage, page(2, "Closing"))),
            new ProcessingSummary(1, 2, 4, 0.5, List.of()));

        JsonNode root = objectMapper.readTree(writer.toJson(result)).get(DocumentResultJsonWriter.ROOT_KEY);

        assertThat(root.at("/document_metadata/filename").asText()).isEqualTo("q3.pdf");
        assertThat(root.at("/document_metadata/total_pages").asInt()).isEqualTo(2);
        assertThat(root.at("/document_metadata/extraction_methods/0").asText()).isEqualTo("ai_failover_routing");
        assertThat(root.at("/tables/tables/0/table_id").asText()).isEqualTo("p1_t1");
        assertThat(root.at("/tables/tables/0/rows/0/is_header_row").asBoolean()).isTrue();
        assertThat(root.at("/tables/tables/0/columns/0/is_header_column").isBoolean()).isTrue();
        assertThat(root.at("/tables/tables/0/region/bounding_box/x1").asDouble()).isEqualTo(100.0);
        assertThat(root.at("/text_content/pages/0/sections/0/llm_ready").asBoolean()).isTrue();
        assertThat(root.at("/text_content/pages/0/sections/0/numbers/0/format").asText()).isEqualTo("currency");
        assertThat(root.at("/text_content/pages/0/sections/0/numbers/0/position/line_number").asInt()).isEqualTo(1);
        assertThat(root.at("/processing_summary/overall_quality_score").asDouble()).isEqualTo(0.5);
    }

    @Test
    void writesJsonFile(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("result.json");

        writer.write(new DocumentResult(null, null, null, null), target);

        JsonNode root = objectMapper.readTree(Files.readString(target));
        assertThat(root.has(DocumentResultJsonWriter.ROOT_KEY)).isTrue();
        assertThat(root.at("/pdf_processing_result/text_content/pages").isArray()).isTrue();
    }
}
