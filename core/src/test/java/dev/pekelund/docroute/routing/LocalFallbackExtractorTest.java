package dev.pekelund.docroute.routing;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pekelund.docroute.ai.PagePayload;
import dev.pekelund.docroute.model.BatchResult;
import dev.pekelund.docroute.model.ExtractionSource;
import dev.pekelund.docroute.model.PageGroup;
import dev.pekelund.docroute.model.Section;
import dev.pekelund.docroute.numbers.NumberExtractor;
import java.util.List;
import org.junit.jupiter.api.Test;

class LocalFallbackExtractorTest {

    private final LocalFallbackExtractor extractor = new LocalFallbackExtractor(new NumberExtractor());

    @Test
    void buildsOneParagraphPerPage() {
        BatchResult batch = extractor.extract(new PageGroup(2, 3),
            List.of(new PagePayload(3, "Revenue $1,000 up 25%", List.of()), new PagePayload(4, "", List.of())),
            "TIMEOUT");

        assertThat(batch.source()).isEqualTo(ExtractionSource.LOCAL_FALLBACK);
        assertThat(batch.failureReason()).isEqualTo("TIMEOUT");
        assertThat(batch.group()).isEqualTo(new PageGroup(2, 3));
        assertThat(batch.pages()).hasSize(2);
        Section first = batch.pages().get(0).sections().get(0);
        assertThat(first.sectionId()).isEqualTo("p3_s1");
        assertThat(first.sectionType()).isEqualTo(Section.PARAGRAPH);
        assertThat(first.llmReady()).isTrue();
        assertThat(first.wordCount()).isEqualTo(4);
        assertThat(batch.processingSummary().overallQualityScore()).isEqualTo(0.5);
        assertThat(batch.processingSummary().textSections()).isEqualTo(2);
        assertThat(batch.processingSummary().numbersFound()).isEqualTo(first.numbers().size());
    }

    @Test
    void truncatesContentButKeepsNumbersFromFullText() {
        String longText = "a ".repeat(1_200) + "total 9,999";

        BatchResult batch = extractor.extract(new PageGroup(0, 0), List.of(new PagePayload(1, longText, List.of())),
            "UNAVAILABLE");

        Section section = batch.pages().get(0).sections().get(0);
        assertThat(section.content()).hasSize(LocalFallbackExtractor.MAX_CONTENT_LENGTH);
        assertThat(section.content()).doesNotContain("9,999");
        assertThat(section.numbers()).extracting(match -> match.originalText()).contains("9,999");
        assertThat(section.wordCount()).isEqualTo(1_202);
    }
}
