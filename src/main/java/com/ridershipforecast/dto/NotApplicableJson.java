package com.ridershipforecast.dto;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes an absent metric as the string {@code "n/a"} and reads it back as {@code null}.
 */
public final class NotApplicableJson {

    public static final String NOT_APPLICABLE = "n/a";

    private NotApplicableJson() {
    }

    public static class NullSerializer extends JsonSerializer<Object> {
        @Override
        public void serialize(Object value, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeString(NOT_APPLICABLE);
        }
    }

    public static class DoubleDeserializer extends JsonDeserializer<Double> {
        @Override
        public Double deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            if (p.currentToken() == JsonToken.VALUE_STRING) {
                String text = p.getText().trim();
                if (text.equalsIgnoreCase(NOT_APPLICABLE) || text.isEmpty()) {
                    return null;
                }
                try {
                    return Double.valueOf(text);
                } catch (NumberFormatException e) {
                    return (Double) ctxt.handleWeirdStringValue(Double.class, text, "expected a number or \"n/a\"");
                }
            }
            return p.getDoubleValue();
        }
    }
}
