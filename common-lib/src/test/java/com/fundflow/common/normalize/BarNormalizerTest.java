package com.fundflow.common.normalize;

import com.fundflow.common.TestBars;
import com.fundflow.common.exception.InvalidInputException;
import com.fundflow.common.model.Bar;
import com.fundflow.common.model.RawBar;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class BarNormalizerTest {

    private static List<RawBar> rising(int count) {
        List<RawBar> rows = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            rows.add(TestBars.raw(i, 99 + i, 100 + i, 10 * (i + 1)));
        }
        return rows;
    }

    @Nested
    @DisplayName("window handling")
    class WindowTests {

        @Test
        @DisplayName("drops the still-forming last row")
        void dropsLastRow() {
            List<RawBar> rows = rising(13);
            List<Bar> bars = BarNormalizer.normalize(rows);

            assertEquals(12, bars.size());
            assertEquals(rows.get(11).openTime(), bars.get(11).openTime().toEpochMilli());
        }

        @Test
        @DisplayName("single row → empty window")
        void singleRow() {
            assertTrue(BarNormalizer.normalize(rising(1)).isEmpty());
        }

        @Test
        @DisplayName("result is unmodifiable")
        void unmodifiable() {
            List<Bar> bars = BarNormalizer.normalize(rising(3));
            assertThrows(UnsupportedOperationException.class, () -> bars.remove(0));
        }

        @Test
        @DisplayName("malformed forming row is ignored with the rest of it")
        void formingRowNotValidated() {
            List<RawBar> rows = rising(3);
            rows.add(RawBar.of(TestBars.START + 3 * TestBars.HOUR, 0, 0, 0, 0, 0,
                TestBars.START + 4 * TestBars.HOUR - 1, 0));
            assertEquals(3, BarNormalizer.normalize(rows).size());
        }
    }

    @Nested
    @DisplayName("buy/sell split")
    class SplitTests {

        @Test
        @DisplayName("bullish bar → 60% buy, 40% sell")
        void bullishSplit() {
            Bar bar = BarNormalizer.enrich(TestBars.raw(0, 100, 110, 50));

            assertEquals(30.0, bar.buyVolume(), 1e-12);
            assertEquals(20.0, bar.sellVolume(), 1e-12);
            assertEquals(10.0 * 110, bar.netInflow(), 1e-9);
            assertEquals(10.0, bar.priceChangePct(), 1e-9);
        }

        @Test
        @DisplayName("bearish bar → 40% buy, 60% sell, negative inflow")
        void bearishSplit() {
            Bar bar = BarNormalizer.enrich(TestBars.raw(0, 110, 100, 50));

            assertEquals(20.0, bar.buyVolume(), 1e-12);
            assertEquals(30.0, bar.sellVolume(), 1e-12);
            assertTrue(bar.netInflow() < 0);
            assertTrue(bar.priceChangePct() < 0);
        }

        @Test
        @DisplayName("doji counts as bullish")
        void dojiIsBullish() {
            Bar bar = BarNormalizer.enrich(TestBars.raw(0, 100, 100, 10));
            assertTrue(bar.buyVolume() > bar.sellVolume());
            assertEquals(0.0, bar.priceChangePct());
        }

        @Test
        @DisplayName("buyVolume + sellVolume == volume exactly")
        void splitSumsExactly() {
            Random random = new Random(7);
            for (int i = 0; i < 1_000; i++) {
                double volume = random.nextDouble() * Math.pow(10, random.nextInt(12) - 4);
                boolean up = random.nextBoolean();
                Bar bar = BarNormalizer.enrich(TestBars.raw(0, up ? 100 : 101, up ? 101 : 100, volume));
                assertEquals(volume, bar.buyVolume() + bar.sellVolume(), "volume " + volume);
            }
        }

        @Test
        @DisplayName("zero volume → zero split and zero inflow")
        void zeroVolume() {
            Bar bar = BarNormalizer.enrich(TestBars.raw(0, 100, 101, 0));
            assertEquals(0.0, bar.buyVolume());
            assertEquals(0.0, bar.sellVolume());
            assertEquals(0.0, bar.netInflow());
        }
    }

    @Nested
    @DisplayName("invalid input")
    class InvalidInputTests {

        @Test
        @DisplayName("null or empty input throws")
        void emptyInput() {
            assertThrows(InvalidInputException.class, () -> BarNormalizer.normalize(null));
            assertThrows(InvalidInputException.class, () -> BarNormalizer.normalize(List.of()));
        }

        @Test
        @DisplayName("non-positive price throws with component prefix")
        void nonPositivePrice() {
            List<RawBar> rows = rising(3);
            rows.set(1, RawBar.of(TestBars.START + TestBars.HOUR, 0, 100, 0, 100, 1,
                TestBars.START + 2 * TestBars.HOUR - 1, 100));

            InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> BarNormalizer.normalize(rows));
            assertEquals("BarNormalizer", ex.getComponent());
            assertTrue(ex.getMessage().startsWith("[BarNormalizer]"));
        }

        @Test
        @DisplayName("negative volume throws")
        void negativeVolume() {
            List<RawBar> rows = rising(3);
            rows.set(0, TestBars.raw(0, 100, 101, -1));
            assertThrows(InvalidInputException.class, () -> BarNormalizer.normalize(rows));
        }

        @Test
        @DisplayName("NaN prices throw instead of propagating into derived fields")
        void nanPrice() {
            List<RawBar> rows = rising(3);
            rows.set(0, RawBar.of(TestBars.START, Double.NaN, Double.NaN, Double.NaN, Double.NaN, 10,
                TestBars.START + TestBars.HOUR - 1, 100));

            InvalidInputException ex = assertThrows(InvalidInputException.class,
                () -> BarNormalizer.normalize(rows));
            assertTrue(ex.getMessage().contains("Non-finite"));
        }

        @Test
        @DisplayName("infinite base or quote volume throws")
        void infiniteVolume() {
            List<RawBar> base = rising(3);
            base.set(1, TestBars.raw(1, 100, 101, Double.POSITIVE_INFINITY));
            assertThrows(InvalidInputException.class, () -> BarNormalizer.normalize(base));

            List<RawBar> quote = rising(3);
            quote.set(0, RawBar.of(TestBars.START, 99, 100, 99, 100, 10,
                TestBars.START + TestBars.HOUR - 1, Double.POSITIVE_INFINITY));
            assertThrows(InvalidInputException.class, () -> BarNormalizer.normalize(quote));
        }

        @Test
        @DisplayName("rows out of time order throw")
        void outOfOrder() {
            List<RawBar> rows = rising(4);
            RawBar first = rows.get(0);
            rows.set(0, rows.get(1));
            rows.set(1, first);
            assertThrows(InvalidInputException.class, () -> BarNormalizer.normalize(rows));
        }

        @Test
        @DisplayName("closeTime not after openTime throws")
        void closeBeforeOpen() {
            List<RawBar> rows = rising(3);
            rows.set(0, RawBar.of(TestBars.START, 100, 101, 99, 100, 1, TestBars.START, 100));
            assertThrows(InvalidInputException.class, () -> BarNormalizer.normalize(rows));
        }
    }
}
