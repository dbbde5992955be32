package com.fundflow.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PriceLevel(
    @JsonProperty("price") double price,
    @JsonProperty("quantity") double quantity
) {
    public static PriceLevel of(double price, double quantity) {
        return new PriceLevel(price, quantity);
    }
}
