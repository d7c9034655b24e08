package com.signalplatform.orchestrator.controller;

import com.signalplatform.common.consensus.ConsensusStatistics;
import com.signalplatform.common.gate.GateStatistics;
import com.signalplatform.common.gate.PreTradeGate;
import com.signalplatform.common.model.Signal;
import com.signalplatform.common.model.Timeframe;
import com.signalplatform.orchestrator.pipeline.SignalDecisionPipeline;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/signals")
public class SignalController {

    static final Timeframe DEFAULT_TIMEFRAME = Timeframe.M15;

    private final SignalDecisionPipeline pipeline;
    private final ConsensusStatistics consensusStatistics;
    private final PreTradeGate preTradeGate;

    public SignalController(SignalDecisionPipeline pipeline, ConsensusStatistics consensusStatistics,
                            PreTradeGate preTradeGate) {
        this.pipeline            = pipeline;
        this.consensusStatistics = consensusStatistics;
        this.preTradeGate        = preTradeGate;
    }

    @PostMapping("/generate")
    public Mono<ResponseEntity<Signal>> generate(@RequestBody GenerateSignalRequest request) {
        if (request.instrument() == null || request.instrument().isBlank()) {
            return Mono.just(ResponseEntity.badRequest().build());
        }
        Timeframe timeframe = request.timeframe() != null ? request.timeframe() : DEFAULT_TIMEFRAME;
        int window = request.analysisWindow() != null ? request.analysisWindow() : 0;
        return pipeline.generateSignal(request.instrument().trim(), timeframe, window)
            .map(ResponseEntity::ok);
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(new StatsResponse(consensusStatistics.snapshot(), preTradeGate.statistics().snapshot()));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    public record StatsResponse(ConsensusStatistics.Snapshot consensus, GateStatistics.Snapshot gate) {}
}
