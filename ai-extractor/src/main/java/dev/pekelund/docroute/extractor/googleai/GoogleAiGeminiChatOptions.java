package dev.pekelund.docroute.extractor.googleai;

import java.util.Objects;
import org.springframework.util.StringUtils;

/**
 * Generation options for Gemini calls. Values left {@code null} are omitted from the request.
 */
public final class GoogleAiGeminiChatOptions {

    public static final String DEFAULT_MODEL = "gemini-2.0-flash";
    public static final String JSON_MIME_TYPE = "application/json";

    private final String model;
    private final Double temperature;
    private final Double topP;
    private final Integer topK;
    private final Integer maxOutputTokens;
    private final String responseMimeType;

    private GoogleAiGeminiChatOptions(Builder builder) {
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.topP = builder.topP;
        this.topK = builder.topK;
        this.maxOutputTokens = builder.maxOutputTokens;
        this.responseMimeType = builder.responseMimeType;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return builder()
            .model(model)
            .temperature(temperature)
            .topP(topP)
            .topK(topK)
            .maxOutputTokens(maxOutputTokens)
            .responseMimeType(responseMimeType);
    }

    /**
     * Returns a copy of these options where every value set on {@code overrides} wins.
     */
    public GoogleAiGeminiChatOptions merge(GoogleAiGeminiChatOptions overrides) {
        if (overrides == null) {
            return this;
        }
        Builder builder = toBuilder();
        if (StringUtils.hasText(overrides.model)) {
            builder.model(overrides.model);
        }
        if (overrides.temperature != null) {
            builder.temperature(overrides.temperature);
        }
        if (overrides.topP != null) {
            builder.topP(overrides.topP);
        }
        if (overrides.topK != null) {
            builder.topK(overrides.topK);
        }
        if (overrides.maxOutputTokens != null) {
            builder.maxOutputTokens(overrides.maxOutputTokens);
        }
        if (StringUtils.hasText(overrides.responseMimeType)) {
            builder.responseMimeType(overrides.responseMimeType);
        }
        return builder.build();
    }

    public String getModel() {
        return model;
    }

    public Double getTemperature() {
        return temperature;
    }

    public Double getTopP() {
        return topP;
    }

    public Integer getTopK() {
        return topK;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    public String getResponseMimeType() {
        return responseMimeType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof GoogleAiGeminiChatOptions that)) {
            return false;
        }
        return Objects.equals(model, that.model)
            && Objects.equals(temperature, that.temperature)
            && Objects.equals(topP, that.topP)
            && Objects.equals(topK, that.topK)
            && Objects.equals(maxOutputTokens, that.maxOutputTokens)
            && Objects.equals(responseMimeType, that.responseMimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, temperature, topP, topK, maxOutputTokens, responseMimeType);
    }

    @Override
    public String toString() {
        return "GoogleAiGeminiChatOptions{"
            + "model='" + model + '\''
            + ", temperature=" + temperature
            + ", topP=" + topP
            + ", topK=" + topK
            + ", maxOutputTokens=" + maxOutputTokens
            + ", responseMimeType=" + responseMimeType
            + '}';
    }

    public static final class Builder {

        private String model;
        private Double temperature;
        private Double topP;
        private Integer topK;
        private Integer maxOutputTokens;
        private String responseMimeType;

        private Builder() {
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            this.responseMimeType = responseMimeType;
            return this;
        }

        public GoogleAiGeminiChatOptions build() {
            return new GoogleAiGeminiChatOptions(this);
        }
    }
}
