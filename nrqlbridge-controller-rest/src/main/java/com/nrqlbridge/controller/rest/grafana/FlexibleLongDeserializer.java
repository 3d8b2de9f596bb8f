package com.nrqlbridge.controller.rest.grafana;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import java.io.IOException;

/** Accepts epoch millis and account ids sent either as JSON numbers or as numeric strings. */
final class FlexibleLongDeserializer extends JsonDeserializer<Long> {

    @Override
    public Long deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        if (parser.currentToken().isNumeric()) {
            return parser.getValueAsLong();
        }
        String text = parser.getValueAsString();
        if (text == null) {
            return (Long) context.handleUnexpectedToken(Long.class, parser);
        }
        String trimmed = text.trim();
        if (trimmed.isEmpty() || "null".equalsIgnoreCase(trimmed)) {
            return null;
        }
        try {
            return Long.valueOf(trimmed);
        } catch (NumberFormatException ex) {
            return (Long) context.handleWeirdStringValue(Long.class, trimmed, "Expected a whole number");
        }
    }
}
