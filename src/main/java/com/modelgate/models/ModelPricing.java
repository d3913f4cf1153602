package com.modelgate.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Prices per million tokens, kept as authored strings. Use
 * {@link #inputPrice()} for comparisons.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ModelPricing(
    String input,
    String output,
    String cachedInput,
    String cacheCreation
) {
    /** Parsed input price; 0 when absent or unparseable. */
    public double inputPrice() {
        return parse(input);
    }

    static double parse(String value) {
        if (value == null || value.isBlank()) return 0;
        try {
            var parsed = Double.parseDouble(value.trim());
            return Double.isNaN(parsed) ? 0 : parsed;
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
