package com.fundflow.analysis.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fundflow.common.model.RawBar;

import java.io.IOException;

import static com.fundflow.analysis.json.ExchangeValues.decimal;
import static com.fundflow.analysis.json.ExchangeValues.epochMillis;

/**
 * Kline row reader. Accepts the exchange array layout
 * {@code [openTime, open, high, low, close, volume, closeTime, quoteVolume, ...]}, with
 * extra trailing columns ignored, or an object with the {@link RawBar} field names.
 */
public class RawBarDeserializer extends StdDeserializer<RawBar> {

    static final int REQUIRED_COLUMNS = 8;

    public RawBarDeserializer() {
        super(RawBar.class);
    }

    @Override
    public RawBar deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);

        if (node.isArray()) {
            if (node.size() < REQUIRED_COLUMNS) {
                return ctxt.reportInputMismatch(RawBar.class,
                    "Kline row needs %d columns, got %d", REQUIRED_COLUMNS, node.size());
            }
            // [openTime, open, high, low, close, volume, closeTime, quoteVolume, trades, ...]
            return RawBar.of(
                epochMillis(node.get(0), RawBar.class, "openTime", ctxt),
                decimal(node.get(1), RawBar.class, "open", ctxt),
                decimal(node.get(2), RawBar.class, "high", ctxt),
                decimal(node.get(3), RawBar.class, "low", ctxt),
                decimal(node.get(4), RawBar.class, "close", ctxt),
                decimal(node.get(5), RawBar.class, "volume", ctxt),
                epochMillis(node.get(6), RawBar.class, "closeTime", ctxt),
                decimal(node.get(7), RawBar.class, "quoteVolume", ctxt));
        }

        if (node.isObject()) {
            return RawBar.of(
                epochMillis(node.get("openTime"), RawBar.class, "openTime", ctxt),
                decimal(node.get("open"), RawBar.class, "open", ctxt),
                decimal(node.get("high"), RawBar.class, "high", ctxt),
                decimal(node.get("low"), RawBar.class, "low", ctxt),
                decimal(node.get("close"), RawBar.class, "close", ctxt),
                decimal(node.get("volume"), RawBar.class, "volume", ctxt),
                epochMillis(node.get("closeTime"), RawBar.class, "closeTime", ctxt),
                decimal(node.get("quoteVolume"), RawBar.class, "quoteVolume", ctxt));
        }

        return ctxt.reportInputMismatch(RawBar.class, "Kline row must be an array or object, got %s",
            node.getNodeType());
    }
}
