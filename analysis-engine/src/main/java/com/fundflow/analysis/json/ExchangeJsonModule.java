package com.fundflow.analysis.json;

import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fundflow.common.model.PriceLevel;
import com.fundflow.common.model.RawBar;

/**
 * Reads exchange payloads in their native row layout: kline rows and depth levels
 * arrive as JSON arrays of decimal strings.
 */
public class ExchangeJsonModule extends SimpleModule {

    public ExchangeJsonModule() {
        super("ExchangeJsonModule");
        addDeserializer(RawBar.class, new RawBarDeserializer());
        addDeserializer(PriceLevel.class, new PriceLevelDeserializer());
    }
}
