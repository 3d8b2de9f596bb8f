package com.nrqlbridge.controller.rest.grafana;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;

/** Panel JSON written by older plugin versions stores toggles as {@code "true"}/{@code "false"}. */
final class FlexibleBooleanDeserializer extends JsonDeserializer<Boolean> {

    @Override
    public Boolean deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isBoolean()) {
            return parser.getBooleanValue();
        }
        String text = parser.getValueAsString();
        if (text == null) {
            return (Boolean) context.handleUnexpectedToken(Boolean.class, parser);
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || "null".equalsIgnoreCase(trimmed)) {
            return null;
        }
        if ("true".equalsIgnoreCase(trimmed) || "false".equalsIgnoreCase(trimmed)) {
            return Boolean.valueOf(trimmed);
        }
        return (Boolean) context.handleWeirdStringValue(Boolean.class, trimmed, "Expected true or false");
    }
}
