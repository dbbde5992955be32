package com.fundflow.analysis.controller;

import com.fundflow.analysis.model.ActiveStrategies;
import com.fundflow.analysis.model.AnalysisReport;
import com.fundflow.analysis.model.AnalysisRequest;
import com.fundflow.analysis.service.FundingFlowAnalysisService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/analyze")
public class AnalysisController {

    private final FundingFlowAnalysisService analysisService;

    public AnalysisController(FundingFlowAnalysisService analysisService) {
        this.analysisService = analysisService;
    }

    @PostMapping
    public Mono<ResponseEntity<AnalysisReport>> analyze(@RequestBody AnalysisRequest request) {
        return analysisService.analyze(request)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/strategies")
    public ResponseEntity<ActiveStrategies> strategies() {
        return ResponseEntity.ok(analysisService.activeStrategies());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
