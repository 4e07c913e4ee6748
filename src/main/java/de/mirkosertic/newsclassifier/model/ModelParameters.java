package de.mirkosertic.newsclassifier.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * JSON layout of an exported model ({@code model_params.json}).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ModelParameters(
        @JsonProperty("vocabulary") @Nullable List<String> vocabulary,
        @JsonProperty("idf_values") double @Nullable [] idfValues,
        @JsonProperty("coefficients") double @Nullable [] coefficients,
        @JsonProperty("intercept") @Nullable Double intercept
) {
}
