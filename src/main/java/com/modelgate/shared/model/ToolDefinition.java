package com.modelgate.shared.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolDefinition(
    String type,
    String name,
    String description,
    JsonNode parameters,
    boolean strict
) {
    public static ToolDefinition function(String name, String description, JsonNode parameters) {
        return new ToolDefinition("function", name, description, parameters, true);
    }
}
