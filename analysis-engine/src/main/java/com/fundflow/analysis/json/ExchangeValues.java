package com.fundflow.analysis.json;

import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;

/**
 * Cell readers shared by the exchange deserializers. Numbers may arrive as JSON numbers
 * or as decimal strings; NaN, infinities and anything else is reported as an input mismatch.
 */
final class ExchangeValues {

    private ExchangeValues() {}

    static double decimal(JsonNode cell, Class<?> target, String field, DeserializationContext ctxt)
            throws IOException {
        double value;
        if (cell != null && cell.isNumber()) {
            value = cell.doubleValue();
        } else if (cell != null && cell.isTextual()) {
            try {
                value = Double.parseDouble(cell.textValue().trim());
            } catch (NumberFormatException e) {
                return ctxt.<Double>reportInputMismatch(target, "Field %s is not a decimal: '%s'", field, cell.textValue());
            }
        } else {
            return ctxt.<Double>reportInputMismatch(target, "Field %s is missing or not numeric", field);
        }
        if (!Double.isFinite(value)) {
            return ctxt.<Double>reportInputMismatch(target, "Field %s is not a finite decimal: '%s'", field, cell.asText());
        }
        return value;
    }

    static long epochMillis(JsonNode cell, Class<?> target, String field, DeserializationContext ctxt)
            throws IOException {
        if (cell != null && cell.canConvertToLong()) {
            return cell.longValue();
        }
        if (cell != null && cell.isTextual()) {
            try {
                return Long.parseLong(cell.textValue().trim());
            } catch (NumberFormatException e) {
                return ctxt.<Long>reportInputMismatch(target, "Field %s is not an epoch millis value: '%s'",
                    field, cell.textValue());
            }
        }
        return ctxt.<Long>reportInputMismatch(target, "Field %s is missing or not an integer", field);
    }
}
