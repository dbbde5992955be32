package com.fundflow.analysis.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fundflow.analysis.Snapshots;
import com.fundflow.analysis.config.AnalysisConfig;
import com.fundflow.analysis.handler.GlobalErrorHandler;
import com.fundflow.analysis.service.FundingFlowAnalysisService;
import com.fundflow.analysis.service.MarketAnalyzer;
import com.fundflow.common.anomaly.AnomalyDetector;
import com.fundflow.common.model.AnomalyMode;
import com.fundflow.common.pressure.PressureStrategy;
import com.fundflow.common.trend.TrendStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.http.codec.json.Jackson2JsonDecoder;
import org.springframework.http.codec.json.Jackson2JsonEncoder;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertTrue;

class AnalysisControllerTest {

    private static final String BALANCED = Snapshots.depthJson("[[\"100.00\",\"2.0\"]]", "[[\"101.00\",\"2.0\"]]");

    private WebTestClient client;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = AnalysisConfig.exchangeObjectMapper();
        MarketAnalyzer marketAnalyzer = new MarketAnalyzer(
            TrendStrategy.REGRESSION.create(),
            AnomalyDetector.forMode(AnomalyMode.RATIO),
            PressureStrategy.FLOW_BOOK.create(),
            1000);
        FundingFlowAnalysisService service = new FundingFlowAnalysisService(marketAnalyzer,
            Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC), 50, "1h", "Binance");

        client = WebTestClient.bindToController(new AnalysisController(service))
            .controllerAdvice(new GlobalErrorHandler())
            .httpMessageCodecs(codecs -> {
                codecs.defaultCodecs().jackson2JsonDecoder(new Jackson2JsonDecoder(mapper));
                codecs.defaultCodecs().jackson2JsonEncoder(new Jackson2JsonEncoder(mapper));
            })
            .build();
    }

    private WebTestClient.ResponseSpec post(String body) {
        return client.post().uri("/api/v1/analyze")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(body)
            .exchange();
    }

    @Test
    @DisplayName("POST /api/v1/analyze → report for exchange-layout snapshots")
    void analyze() {
        post(Snapshots.requestJson("4h", "BTCUSDT", BALANCED, 13))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.metadata.analysisTime").isEqualTo("2024-05-01T12:00:00Z")
            .jsonPath("$.metadata.interval").isEqualTo("4h")
            .jsonPath("$.metadata.symbolsAnalyzed.length()").isEqualTo(1)
            .jsonPath("$.metadata.symbolsAnalyzed[0]").isEqualTo("BTCUSDT")
            .jsonPath("$.metadata.klinesCount").isEqualTo(12)
            .jsonPath("$.metadata.dataSourceName").isEqualTo("Binance")
            .jsonPath("$.analysis.BTCUSDT.spot.fundingTrend.stage").isEqualTo("UPTREND")
            .jsonPath("$.analysis.BTCUSDT.spot.fundingTrend.trend").isEqualTo("INCREASING")
            .jsonPath("$.analysis.BTCUSDT.spot.orderBook.imbalance").isEqualTo(0.0)
            .jsonPath("$.analysis.BTCUSDT.comparison.volumeRatio").isEqualTo(2.0)
            .jsonPath("$.analysis.BTCUSDT.futures.anomalies.mode").isEqualTo("RATIO");
    }

    @Test
    @DisplayName("ask side with zero quantity → pressure ratio written as \"Infinity\"")
    void unboundedPressureRatio() {
        String depth = Snapshots.depthJson("[[\"100.00\",\"2.0\"]]", "[[\"101.00\",\"0\"]]");

        post(Snapshots.requestJson("1h", "BTCUSDT", depth, 13))
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.analysis.BTCUSDT.spot.orderBook.pressureRatio").isEqualTo("Infinity")
            .jsonPath("$.analysis.BTCUSDT.spot.fundingPressure.bidAskRatio").isEqualTo("Infinity");
    }

    @Test
    @DisplayName("empty bid side → 400 invalid_input")
    void emptyDepthSide() {
        String depth = Snapshots.depthJson("[]", "[[\"101.00\",\"2.0\"]]");

        post(Snapshots.requestJson("1h", "BTCUSDT", depth, 13))
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("invalid_input")
            .jsonPath("$.message").value(message ->
                assertTrue(((String) message).startsWith("[DepthAggregator]"), String.valueOf(message)));
    }

    @Test
    @DisplayName("short kline row → 400 bad_request")
    void malformedRow() {
        String body = "{\"interval\":\"1h\",\"symbols\":[{\"symbol\":\"BTCUSDT\","
            + "\"spot\":{\"klines\":[[1,\"2\",\"3\"]],\"depth\":" + BALANCED + "},"
            + "\"futures\":{\"klines\":[[1,\"2\",\"3\"]],\"depth\":" + BALANCED + "}}]}";

        post(body)
            .expectStatus().isBadRequest()
            .expectBody()
            .jsonPath("$.error").isEqualTo("bad_request");
    }

    @Test
    @DisplayName("unknown interval → 400")
    void unknownInterval() {
        post(Snapshots.requestJson("7m", "BTCUSDT", BALANCED, 13))
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("GET /api/v1/analyze/strategies lists the active strategies")
    void strategies() {
        client.get().uri("/api/v1/analyze/strategies")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.trend").isEqualTo("REGRESSION")
            .jsonPath("$.anomaly").isEqualTo("RATIO")
            .jsonPath("$.pressure").isEqualTo("FLOW_BOOK")
            .jsonPath("$.windowSize").isEqualTo(50);
    }

    @Test
    @DisplayName("GET /api/v1/analyze/health → OK")
    void health() {
        client.get().uri("/api/v1/analyze/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
