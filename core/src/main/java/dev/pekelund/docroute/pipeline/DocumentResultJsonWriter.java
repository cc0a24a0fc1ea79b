package dev.pekelund.docroute.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.pekelund.docroute.model.DocumentResult;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Serialises a {@link DocumentResult} under the {@code pdf_processing_result} root key.
 */
public class DocumentResultJsonWriter {

    public static final String ROOT_KEY = "pdf_processing_result";

    private final ObjectMapper objectMapper;

    public DocumentResultJsonWriter() {
        this(new ObjectMapper().findAndRegisterModules());
    }

    public DocumentResultJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(DocumentResult result) {
        try {
            return objectMapper.writeValueAsString(Map.of(ROOT_KEY, result));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Failed to serialise document result", ex);
        }
    }

    public void write(DocumentResult result, Path target) {
        try {
            Files.writeString(target, toJson(result));
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write document result to " + target, ex);
        }
    }
}
