package com.bank.lending.model;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Reads a transaction amount without failing the enclosing request. Numbers and numeric
 * strings bind as usual; anything else ("12,50", "", true, an object) binds as null so the
 * classifier can route that one record to the malformed-input fallback.
 */
public class LenientAmountDeserializer extends JsonDeserializer<Double> {

    private static final Logger log = LoggerFactory.getLogger(LenientAmountDeserializer.class);

    @Override
    public Double deserialize(JsonParser parser, DeserializationContext context) throws IOException {
        JsonToken token = parser.currentToken();
        if (token == JsonToken.VALUE_NUMBER_INT || token == JsonToken.VALUE_NUMBER_FLOAT) {
            return parser.getDoubleValue();
        }
        if (token == JsonToken.VALUE_STRING) {
            String text = parser.getText().trim();
            try {
                return Double.valueOf(text);
            } catch (NumberFormatException e) {
                log.warn("Unparseable transaction amount '{}', treating as missing", text);
                return null;
            }
        }
        parser.skipChildren();
        log.warn("Non-numeric transaction amount of type {}, treating as missing", token);
        return null;
    }
}
