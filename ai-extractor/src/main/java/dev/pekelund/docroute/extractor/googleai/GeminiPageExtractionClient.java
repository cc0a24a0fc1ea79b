package dev.pekelund.docroute.extractor.googleai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.pekelund.docroute.ai.AiExtractionClient;
import dev.pekelund.docroute.ai.AiExtractionException;
import dev.pekelund.docroute.ai.AiExtractionResponse;
import dev.pekelund.docroute.ai.PagePayload;
import dev.pekelund.docroute.source.PositionedWord;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * {@link AiExtractionClient} that asks Gemini for tables and text sections of a page group and
 * parses the JSON reply into an {@link AiExtractionResponse}.
 */
public class GeminiPageExtractionClient implements AiExtractionClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeminiPageExtractionClient.class);

    static final String FORMAT_INSTRUCTIONS = """
        Return a JSON object with the following structure:
        {
          "tables": [
            {
              "table_id": string,
              "name": string|null,
              "region": {"page_number": number, "bounding_box": {"x0": number, "y0": number, "x1": number, "y1": number}, "detection_method": "ai"},
              "header_info": {"header_rows": [number], "header_columns": [number], "data_start_row": number, "data_start_col": number},
              "columns": [{"column_index": number, "column_label": string, "is_header_column": boolean}],
              "rows": [{"row_index": number, "row_label": string, "is_header_row": boolean, "cells": [string]}],
              "metadata": {"detection_method": "ai", "cell_count": number, "has_merged_cells": boolean, "confidence": number}
            }
          ],
          "pages": [
            {
              "page_number": number,
              "sections": [
                {"section_id": string, "section_type": "paragraph", "title": string|null, "content": string, "word_count": number, "llm_ready": true, "numbers": []}
              ]
            }
          ],
          "processing_summary": {"tables_extracted": number, "text_sections": number, "numbers_found": number, "overall_quality_score": number, "processing_errors": [string]}
        }
        Use the page numbers given in the page tags. Keep table cells as the text printed in the document.
        Do not add code fences or commentary; return only the JSON document.
        """;

    private final GeminiClient geminiClient;
    private final ObjectMapper objectMapper;
    private final GoogleAiGeminiChatOptions chatOptions;
    private final boolean enabled;
    private final boolean visionEnabled;

    public GeminiPageExtractionClient(GeminiClient geminiClient, ObjectMapper objectMapper,
        GoogleAiGeminiChatOptions chatOptions, boolean enabled, boolean visionEnabled) {
        this.geminiClient = geminiClient;
        this.objectMapper = objectMapper;
        this.chatOptions = chatOptions;
        this.enabled = enabled;
        this.visionEnabled = visionEnabled;
    }

    @Override
    public boolean isAvailable() {
        return enabled && geminiClient != null;
    }

    @Override
    public boolean supportsVision() {
        return visionEnabled;
    }

    @Override
    public AiExtractionResponse extract(List<PagePayload> pages) {
        if (!isAvailable()) {
            throw new AiExtractionException("Gemini extraction is not configured");
        }
        if (pages == null || pages.isEmpty()) {
            return AiExtractionResponse.empty();
        }

        String prompt = buildPrompt(pages);
        LOGGER.debug("Requesting Gemini extraction for {} pages (prompt length {})", pages.size(), prompt.length());

        String response;
        try {
            response = geminiClient.generateContent(prompt, chatOptions);
        } catch (RuntimeException ex) {
            throw new AiExtractionException("Gemini call failed", ex);
        }
        if (!StringUtils.hasText(response)) {
            throw new AiExtractionException("Gemini returned an empty response");
        }

        String sanitised = sanitiseResponse(response);
        try {
            AiExtractionResponse parsed = objectMapper.readValue(sanitised, AiExtractionResponse.class);
            if (parsed == null) {
                throw new AiExtractionException("Gemini returned a null document");
            }
            return parsed.normalized();
        } catch (JsonProcessingException ex) {
            throw new AiExtractionException("Unable to parse Gemini response as extraction JSON", ex);
        }
    }

    String buildPrompt(List<PagePayload> pages) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("You are an expert system that extracts tables and text sections from PDF pages.\n");
        prompt.append("Each page's text is provided between <page> tags.\n");
        prompt.append(FORMAT_INSTRUCTIONS).append('\n');
        for (PagePayload page : pages) {
            prompt.append("<page number=\"").append(page.pageNumber()).append("\">\n");
            prompt.append(page.text()).append('\n');
            if (visionEnabled && !page.words().isEmpty()) {
                prompt.append("<words>\n");
                for (PositionedWord word : page.words()) {
                    prompt.append(String.format(Locale.ROOT, "%.1f,%.1f,%.1f,%.1f,%d\t%s%n",
                        word.x0(), word.y0(), word.x1(), word.y1(), word.lineId(), word.text()));
                }
                prompt.append("</words>\n");
            }
            prompt.append("</page>\n");
        }
        return prompt.toString();
    }

    static String sanitiseResponse(String response) {
        String trimmed = response.trim();
        if (trimmed.startsWith("```") && trimmed.endsWith("```") && trimmed.length() >= 6) {
            int firstBreak = trimmed.indexOf('\n');
            if (firstBreak > 0) {
                trimmed = trimmed.substring(firstBreak + 1, trimmed.length() - 3).trim();
            } else {
                trimmed = trimmed.substring(3, trimmed.length() - 3).trim();
            }
        }
        if (trimmed.length() >= 2 && trimmed.startsWith("`") && trimmed.endsWith("`")) {
            trimmed = trimmed.substring(1, trimmed.length() - 1).trim();
        }
        return trimmed;
    }
}
