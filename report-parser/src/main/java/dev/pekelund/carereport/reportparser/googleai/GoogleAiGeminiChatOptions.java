package dev.pekelund.carereport.reportparser.googleai;

import java.util.List;
import java.util.Objects;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

/**
 * Generation settings for Gemini calls. {@code responseMimeType} asks Gemini for a specific output
 * format, e.g. {@code application/json} for the event extraction prompt.
 */
public class GoogleAiGeminiChatOptions implements ChatOptions {

    private final String model;
    private final Double temperature;
    private final Double topP;
    private final Integer topK;
    private final Integer maxOutputTokens;
    private final List<String> stopSequences;
    private final String responseMimeType;

    private GoogleAiGeminiChatOptions(Builder builder) {
        this.model = builder.model;
        this.temperature = builder.temperature;
        this.topP = builder.topP;
        this.topK = builder.topK;
        this.maxOutputTokens = builder.maxOutputTokens;
        this.stopSequences = builder.stopSequences != null ? List.copyOf(builder.stopSequences) : List.of();
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
            .stopSequences(stopSequences)
            .responseMimeType(responseMimeType);
    }

    /**
     * Returns these options with every value set in {@code overrides} replacing the current one.
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
        if (!CollectionUtils.isEmpty(overrides.stopSequences)) {
            builder.stopSequences(overrides.stopSequences);
        }
        if (StringUtils.hasText(overrides.responseMimeType)) {
            builder.responseMimeType(overrides.responseMimeType);
        }
        return builder.build();
    }

    @Override
    public String getModel() {
        return model;
    }

    @Override
    public Double getTemperature() {
        return temperature;
    }

    @Override
    public Double getTopP() {
        return topP;
    }

    @Override
    public Integer getTopK() {
        return topK;
    }

    public Integer getMaxOutputTokens() {
        return maxOutputTokens;
    }

    @Override
    public Integer getMaxTokens() {
        return maxOutputTokens;
    }

    @Override
    public List<String> getStopSequences() {
        return stopSequences;
    }

    public String getResponseMimeType() {
        return responseMimeType;
    }

    /**
     * Gemini has no frequency penalty knob in the generateContent API used here.
     */
    @Override
    public Double getFrequencyPenalty() {
        return null;
    }

    @Override
    public Double getPresencePenalty() {
        return null;
    }

    @Override
    @SuppressWarnings("unchecked")
    public <T extends ChatOptions> T copy() {
        return (T) toBuilder().build();
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
            && Objects.equals(stopSequences, that.stopSequences)
            && Objects.equals(responseMimeType, that.responseMimeType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(model, temperature, topP, topK, maxOutputTokens, stopSequences, responseMimeType);
    }

    @Override
    public String toString() {
        return "GoogleAiGeminiChatOptions{"
            + "model='" + model + '\''
            + ", temperature=" + temperature
            + ", topP=" + topP
            + ", topK=" + topK
            + ", maxOutputTokens=" + maxOutputTokens
            + ", responseMimeType='" + responseMimeType + '\''
            + '}';
    }

    public static class Builder implements ChatOptions.Builder {

        private String model;
        private Double temperature;
        private Double topP;
        private Integer topK;
        private Integer maxOutputTokens;
        private List<String> stopSequences;
        private String responseMimeType;

        @Override
        public Builder model(String model) {
            this.model = model;
            return this;
        }

        @Override
        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        @Override
        public Builder topP(Double topP) {
            this.topP = topP;
            return this;
        }

        @Override
        public Builder topK(Integer topK) {
            this.topK = topK;
            return this;
        }

        public Builder maxOutputTokens(Integer maxOutputTokens) {
            this.maxOutputTokens = maxOutputTokens;
            return this;
        }

        @Override
        public Builder maxTokens(Integer maxTokens) {
            return maxOutputTokens(maxTokens);
        }

        @Override
        public Builder stopSequences(List<String> stopSequences) {
            this.stopSequences = stopSequences;
            return this;
        }

        public Builder responseMimeType(String responseMimeType) {
            this.responseMimeType = responseMimeType;
            return this;
        }

        @Override
        public Builder frequencyPenalty(Double frequencyPenalty) {
            return this;
        }

        @Override
        public Builder presencePenalty(Double presencePenalty) {
            return this;
        }

        @Override
        public GoogleAiGeminiChatOptions build() {
            return new GoogleAiGeminiChatOptions(this);
        }
    }
}
