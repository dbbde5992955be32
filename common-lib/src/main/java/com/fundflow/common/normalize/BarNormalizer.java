package com.fundflow.common.normalize;

import com.fundflow.common.exception.InvalidInputException;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.RawBar;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Turns exchange kline rows into enriched {@link Bar} records.
 *
 * <h3>Contract</h3>
 * <ul>
 *   <li>The caller over-fetches by one row; the last row is the still-forming candle and
 *       is dropped unconditionally. Output length = input length - 1.</li>
 *   <li>Buy/sell split: bullish bar (close &ge; open) 60% buy / 40% sell, bearish bar
 *       40% / 60%. The minor share is derived as {@code volume - majorShare}, so the two
 *       halves sum back to {@code volume} exactly.</li>
 *   <li>{@code netInflow = (buyVolume - sellVolume) * close}</li>
 *   <li>{@code priceChangePct = (close - open) / open * 100}</li>
 * </ul>
 *
 * <p>Throws {@link InvalidInputException} for an empty input, NaN or infinite values,
 * non-positive prices, negative volumes, or rows that are not strictly ascending in time.
 */
public final class BarNormalizer {

    private static final String COMPONENT = "BarNormalizer";

    /** Share of volume attributed to the dominant side of the candle. */
    static final double MAJOR_SHARE = 0.6;

    private BarNormalizer() {}

    public static List<Bar> normalize(List<RawBar> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidInputException(COMPONENT, "No kline rows supplied");
        }

        List<Bar> bars = new ArrayList<>(rows.size() - 1);
        long previousOpen = Long.MIN_VALUE;
        for (int i = 0; i < rows.size() - 1; i++) {
            RawBar row = rows.get(i);
            validate(row, i);
            if (row.openTime() <= previousOpen) {
                throw new InvalidInputException(COMPONENT,
                    "Kline rows not strictly ascending at index " + i);
            }
            previousOpen = row.openTime();
            bars.add(enrich(row));
        }
        return Collections.unmodifiableList(bars);
    }

    static Bar enrich(RawBar row) {
        double volume = row.volume();
        double major  = volume * MAJOR_SHARE;
        double minor  = volume - major;

        boolean bullish = row.close() >= row.open();
        double buyVolume  = bullish ? major : minor;
        double sellVolume = bullish ? minor : major;

        double netInflow      = (buyVolume - sellVolume) * row.close();
        double priceChangePct = (row.close() - row.open()) / row.open() * 100.0;

        return new Bar(
            Instant.ofEpochMilli(row.openTime()),
            Instant.ofEpochMilli(row.closeTime()),
            row.open(), row.high(), row.low(), row.close(),
            volume, row.quoteVolume(),
            buyVolume, sellVolume,
            netInflow, priceChangePct);
    }

    private static void validate(RawBar row, int index) {
        if (row == null) {
            throw new InvalidInputException(COMPONENT, "Null kline row at index " + index);
        }
        if (!allFinite(row.open(), row.high(), row.low(), row.close(), row.volume(), row.quoteVolume())) {
            throw new InvalidInputException(COMPONENT,
                "Non-finite value at index " + index + " openTime=" + row.openTime());
        }
        if (row.open() <= 0 || row.high() <= 0 || row.low() <= 0 || row.close() <= 0) {
            throw new InvalidInputException(COMPONENT,
                "Non-positive price at index " + index + " openTime=" + row.openTime());
        }
        if (row.volume() < 0 || row.quoteVolume() < 0) {
            throw new InvalidInputException(COMPONENT,
                "Negative volume at index " + index + " openTime=" + row.openTime());
        }
        if (row.closeTime() <= row.openTime()) {
            throw new InvalidInputException(COMPONENT,
                "closeTime must be after openTime at index " + index);
        }
    }

    private static boolean allFinite(double... values) {
        for (double value : values) {
            if (!Double.isFinite(value)) {
                return false;
            }
        }
        return true;
    }
}
