package com.hourlyhigh.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.hourlyhigh.error.InvalidTradeException;
import com.hourlyhigh.model.PricePolicy;
import com.hourlyhigh.model.Trade;

/**
 * A trade as submitted from outside, not yet validated.
 * The price is kept as text so it never passes through floating point.
 *
 * @param timestamp Unix timestamp in seconds
 * @param category  Category id
 * @param price     Decimal price, e.g. "10.25"
 */
public record TradeRequest(Long timestamp, Integer category, String price) {

    /**
     * Read one submitted JSON record. Field types are checked here rather than by the body binding, so a badly
     * typed record is rejected on its own.
     *
     * @throws InvalidTradeException if the record is not an object or a field has the wrong type
     */
    public static TradeRequest fromJson(JsonNode node) {
        if (node == null || !node.isObject()) throw new InvalidTradeException("Trade must be a JSON object");
        return new TradeRequest(longField(node, "timestamp"), intField(node, "category"), priceField(node));
    }

    private static Long longField(JsonNode record, String name) {
        JsonNode value = record.get(name);
        if (value == null || value.isNull()) return null;
        if (value.isIntegralNumber() && value.canConvertToLong()) return value.asLong();
        if (value.isTextual()) {
            try {
                return Long.parseLong(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidTradeException(capitalize(name) + " is not an integer: " + value.asText(), e);
            }
        }
        throw new InvalidTradeException(capitalize(name) + " is not a 64-bit integer: " + value);
    }

    private static Integer intField(JsonNode record, String name) {
        JsonNode value = record.get(name);
        if (value == null || value.isNull()) return null;
        if (value.isIntegralNumber() && value.canConvertToInt()) return value.asInt();
        if (value.isTextual()) {
            try {
                return Integer.parseInt(value.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvalidTradeException(capitalize(name) + " is not a 32-bit integer: " + value.asText(), e);
            }
        }
        throw new InvalidTradeException(capitalize(name) + " is not a 32-bit integer: " + value);
    }

    private static String priceField(JsonNode record) {
        JsonNode value = record.get("price");
        if (value == null || value.isNull()) return null;
        if (value.isTextual()) return value.asText();
        if (value.isNumber()) return value.decimalValue().toPlainString();
        throw new InvalidTradeException("Price is not a decimal number: " + value);
    }

    private static String capitalize(String name) {
        return Character.toUpperCase(name.charAt(0)) + name.substring(1);
    }

    /**
     * @throws InvalidTradeException if a field is missing or malformed
     */
    public Trade toTrade() {
        if (timestamp == null) throw new InvalidTradeException("Timestamp is required");
        if (category == null) throw new InvalidTradeException("Category is required");
        return new Trade(timestamp, category, PricePolicy.parse(price));
    }
}
