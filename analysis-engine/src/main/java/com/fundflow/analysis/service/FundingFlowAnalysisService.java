package com.fundflow.analysis.service;

import com.fundflow.analysis.model.ActiveStrategies;
import com.fundflow.analysis.model.AnalysisMetadata;
import com.fundflow.analysis.model.AnalysisReport;
import com.fundflow.analysis.model.AnalysisRequest;
import com.fundflow.analysis.model.SymbolAnalysis;
import com.fundflow.analysis.model.SymbolSnapshot;
import com.fundflow.common.comparison.MarketComparator;
import com.fundflow.common.exception.InvalidInputException;
import com.fundflow.common.model.ComparisonResult;
import com.fundflow.common.model.Interval;
import com.fundflow.common.model.MarketKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Analyses every (symbol, market) pair of a request in parallel and assembles the
 * report. Any failing market fails the whole request; no partial report is built.
 */
@Service
public class FundingFlowAnalysisService {

    private static final Logger log = LoggerFactory.getLogger(FundingFlowAnalysisService.class);
    private static final String COMPONENT = "FundingFlowAnalysisService";

    private final MarketAnalyzer marketAnalyzer;
    private final Clock          clock;
    private final int            windowSize;
    private final Interval       defaultInterval;
    private final String         dataSourceName;

    public FundingFlowAnalysisService(MarketAnalyzer marketAnalyzer,
                                      Clock clock,
                                      @Value("${analysis.window-size:50}") int windowSize,
                                      @Value("${analysis.default-interval:1h}") String defaultInterval,
                                      @Value("${analysis.data-source-name:Binance}") String dataSourceName) {
        this.marketAnalyzer  = marketAnalyzer;
        this.clock           = clock;
        this.windowSize      = windowSize;
        this.defaultInterval = Interval.fromCode(defaultInterval);
        this.dataSourceName  = dataSourceName;
    }

    public Mono<AnalysisReport> analyze(AnalysisRequest request) {
        return Mono.defer(() -> {
            List<SymbolSnapshot> symbols = requireSymbols(request);
            Interval interval = request.interval() != null ? request.interval() : defaultInterval;
            int window        = resolveWindow(request);

            log.info("Analysis started. symbols={} interval={} window={}", symbols.size(), interval.code(), window);
            return Flux.fromIterable(symbols)
                .flatMap(snapshot -> Flux.fromArray(MarketKind.values())
                    .flatMap(kind -> analyzeMarket(snapshot, kind, window)))
                .collectList()
                .map(runs -> assemble(symbols, interval, window, runs))
                .doOnSuccess(report -> log.info("Analysis complete. symbols={} interval={}",
                    report.metadata().symbolsAnalyzed().size(), interval.code()));
        });
    }

    public ActiveStrategies activeStrategies() {
        return new ActiveStrategies(marketAnalyzer.trendStrategy(), marketAnalyzer.anomalyMode(),
            marketAnalyzer.pressureStrategy(), windowSize, marketAnalyzer.depthLimit());
    }

    private Mono<MarketRun> analyzeMarket(SymbolSnapshot snapshot, MarketKind kind, int window) {
        return Mono.fromCallable(() -> marketAnalyzer.analyze(snapshot.symbol(), kind, snapshot.market(kind)))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(run -> {
                log.info("Market analysed. symbol={} market={} bars={} stage={} trend={} pressure={} anomalies={}",
                    run.symbol(), kind, run.bars().size(),
                    run.analysis().fundingTrend().stage(),
                    run.analysis().fundingTrend().trend(),
                    run.analysis().fundingPressure().direction(),
                    run.analysis().anomalies().anomalies().size());
                if (run.bars().size() != window) {
                    log.warn("Bar count differs from window. symbol={} market={} bars={} window={}",
                        run.symbol(), kind, run.bars().size(), window);
                }
            })
            .doOnError(e -> log.warn("Market analysis failed. symbol={} market={} reason={}",
                snapshot.symbol(), kind, e.getMessage()));
    }

    private AnalysisReport assemble(List<SymbolSnapshot> symbols, Interval interval, int window,
                                    List<MarketRun> runs) {
        Map<String, Map<MarketKind, MarketRun>> bySymbol = new HashMap<>();
        for (MarketRun run : runs) {
            bySymbol.computeIfAbsent(run.symbol(), s -> new EnumMap<>(MarketKind.class)).put(run.kind(), run);
        }

        Map<String, SymbolAnalysis> analysis = new LinkedHashMap<>();
        for (SymbolSnapshot snapshot : symbols) {
            Map<MarketKind, MarketRun> markets = bySymbol.get(snapshot.symbol());
            MarketRun spot    = markets.get(MarketKind.SPOT);
            MarketRun futures = markets.get(MarketKind.FUTURES);

            ComparisonResult comparison = MarketComparator.compare(
                spot.bars(), spot.analysis().fundingTrend(),
                futures.bars(), futures.analysis().fundingTrend());
            analysis.put(snapshot.symbol(), new SymbolAnalysis(spot.analysis(), futures.analysis(), comparison));
        }

        AnalysisMetadata metadata = new AnalysisMetadata(
            clock.instant(),
            symbols.stream().map(SymbolSnapshot::symbol).collect(Collectors.toUnmodifiableList()),
            interval, dataSourceName, window);
        return new AnalysisReport(metadata, Collections.unmodifiableMap(analysis));
    }

    private List<SymbolSnapshot> requireSymbols(AnalysisRequest request) {
        if (request == null || request.symbols() == null || request.symbols().isEmpty()) {
            throw new InvalidInputException(COMPONENT, "No symbols requested");
        }
        Set<String> seen = new HashSet<>();
        for (SymbolSnapshot snapshot : request.symbols()) {
            if (snapshot == null || snapshot.symbol() == null || snapshot.symbol().isBlank()) {
                throw new InvalidInputException(COMPONENT, "Symbol name is required");
            }
            if (!seen.add(snapshot.symbol())) {
                throw new InvalidInputException(COMPONENT, "Duplicate symbol=" + snapshot.symbol());
            }
        }
        return request.symbols();
    }

    private int resolveWindow(AnalysisRequest request) {
        int window = request.windowSize() != null ? request.windowSize() : windowSize;
        if (window < 1) {
            throw new InvalidInputException(COMPONENT, "windowSize must be positive, got " + window);
        }
        return window;
    }
}
