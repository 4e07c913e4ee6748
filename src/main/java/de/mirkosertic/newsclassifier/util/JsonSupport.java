package de.mirkosertic.newsclassifier.util;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.jspecify.annotations.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON rendering of results and errors for the command line output.
 */
public final class JsonSupport {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);

    private JsonSupport() {
    }

    /**
     * Serialize an object, typically a result record, to a single line of JSON.
     */
    public static String toJson(final Object obj) {
        try {
            return OBJECT_MAPPER.writeValueAsString(obj);
        } catch (final JsonProcessingException e) {
            return errorJson(null, "JSON serialization error: " + e.getOriginalMessage());
        }
    }

    /**
     * Create an error document, optionally naming the input that failed.
     */
    public static String errorJson(final @Nullable String source, final String message) {
        final Map<String, Object> error = new LinkedHashMap<>();
        error.put("success", false);
        if (source != null) {
            error.put("source", source);
        }
        error.put("error", message);
        try {
            return OBJECT_MAPPER.writeValueAsString(error);
        } catch (final JsonProcessingException e) {
            // A map of strings and booleans always serializes
            throw new IllegalStateException(e);
        }
    }
}
