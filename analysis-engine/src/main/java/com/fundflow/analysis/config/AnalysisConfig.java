package com.fundflow.analysis.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fundflow.analysis.json.ExchangeJsonModule;
import com.fundflow.common.anomaly.AnomalyDetector;
import com.fundflow.common.model.AnomalyMode;
import com.fundflow.common.pressure.PressureAnalyzer;
import com.fundflow.common.pressure.PressureStrategy;
import com.fundflow.common.trend.TrendClassifier;
import com.fundflow.common.trend.TrendStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Strategy selection and JSON setup. Each analysis component has two variants that
 * disagree numerically; the active one is always an explicit configuration choice.
 */
@Configuration
public class AnalysisConfig {

    @Value("${analysis.trend-strategy:REGRESSION}")
    private TrendStrategy trendStrategy;

    @Value("${analysis.anomaly-mode:RATIO}")
    private AnomalyMode anomalyMode;

    @Value("${analysis.pressure-strategy:FLOW_BOOK}")
    private PressureStrategy pressureStrategy;

    @Bean
    public TrendClassifier trendClassifier() {
        return trendStrategy.create();
    }

    @Bean
    public AnomalyDetector anomalyDetector() {
        return AnomalyDetector.forMode(anomalyMode);
    }

    @Bean
    public PressureAnalyzer pressureAnalyzer() {
        return pressureStrategy.create();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return exchangeObjectMapper();
    }

    /** ISO-8601 instants, exchange row layouts, unknown request fields ignored. */
    public static ObjectMapper exchangeObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(new ExchangeJsonModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
