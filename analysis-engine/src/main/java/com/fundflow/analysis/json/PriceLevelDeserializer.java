package com.fundflow.analysis.json;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import com.fundflow.common.model.PriceLevel;

import java.io.IOException;

import static com.fundflow.analysis.json.ExchangeValues.decimal;

/** Depth level reader: {@code ["price", "qty"]} or {@code {"price": .., "quantity": ..}}. */
public class PriceLevelDeserializer extends StdDeserializer<PriceLevel> {

    public PriceLevelDeserializer() {
        super(PriceLevel.class);
    }

    @Override
    public PriceLevel deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonNode node = p.getCodec().readTree(p);

        if (node.isArray()) {
            if (node.size() < 2) {
                return ctxt.reportInputMismatch(PriceLevel.class, "Depth level needs [price, qty], got %d cells",
                    node.size());
            }
            return PriceLevel.of(
                decimal(node.get(0), PriceLevel.class, "price", ctxt),
                decimal(node.get(1), PriceLevel.class, "quantity", ctxt));
        }

        if (node.isObject()) {
            return PriceLevel.of(
                decimal(node.get("price"), PriceLevel.class, "price", ctxt),
                decimal(node.get("quantity"), PriceLevel.class, "quantity", ctxt));
        }

        return ctxt.reportInputMismatch(PriceLevel.class, "Depth level must be an array or object, got %s",
            node.getNodeType());
    }
}
