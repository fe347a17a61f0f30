package com.pivotbot.backend.controller;

import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.CycleReport;
import com.pivotbot.backend.model.PortfolioSnapshot;
import com.pivotbot.backend.model.TradeRecord;
import com.pivotbot.backend.model.TradingStatusResponse;
import com.pivotbot.backend.service.DecisionEngine;
import com.pivotbot.backend.service.PortfolioLedger;
import com.pivotbot.backend.service.TradeLimiter;
import com.pivotbot.backend.service.TradingCycleService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/bot")
@CrossOrigin(origins = "http://localhost:3000")
public class TradingStatusController {

    private final TradingCycleService tradingCycleService;
    private final DecisionEngine decisionEngine;
    private final PortfolioLedger ledger;
    private final TradeLimiter tradeLimiter;
    private final TradingProperties properties;
    private final Clock clock;

    @Autowired
    public TradingStatusController(TradingCycleService tradingCycleService,
                                   DecisionEngine decisionEngine,
                                   PortfolioLedger ledger,
                                   TradeLimiter tradeLimiter,
                                   TradingProperties properties,
                                   Clock clock) {
        this.tradingCycleService = tradingCycleService;
        this.decisionEngine = decisionEngine;
        this.ledger = ledger;
        this.tradeLimiter = tradeLimiter;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Latest cycle report plus the live limiter and P&L figures.
     */
    @GetMapping("/status")
    public ResponseEntity<TradingStatusResponse> getStatus() {
        CycleReport lastCycle = tradingCycleService.getLastReport();
        PortfolioSnapshot portfolio = ledger.snapshot();
        TradingStatusResponse response = TradingStatusResponse.builder()
                .symbol(properties.getSymbol())
                .state(decisionEngine.getState())
                .cycleRunning(tradingCycleService.isCycleRunning())
                .lastCycleAt(lastCycle != null ? lastCycle.getTimestamp() : null)
                .lastCycle(lastCycle)
                .limiter(tradeLimiter.status(clock.instant()))
                .realizedPnl(portfolio.getRealizedPnl())
                .unrealizedPnl(portfolio.getUnrealizedPnl())
                .portfolioValue(portfolio.getPortfolioValue())
                .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Trade history with win/loss statistics.
     */
    @GetMapping("/trades")
    public ResponseEntity<Map<String, Object>> getTrades() {
        PortfolioSnapshot portfolio = ledger.snapshot();
        List<TradeRecord> trades = portfolio.getTrades();
        Map<String, Object> response = new HashMap<>();
        response.put("trades", trades);
        response.put("success", true);
        response.put("count", trades.size());
        response.put("winningTrades", portfolio.getWinningTrades());
        response.put("losingTrades", portfolio.getLosingTrades());
        response.put("winRate", portfolio.getWinRate());
        response.put("largestWin", portfolio.getLargestWin());
        response.put("largestLoss", portfolio.getLargestLoss());
        response.put("realizedPnl", portfolio.getRealizedPnl());
        return ResponseEntity.ok(response);
    }

    /**
     * Runs a cycle now. Answers 409 if a cycle is already running.
     */
    @PostMapping("/cycle")
    public ResponseEntity<Map<String, Object>> triggerCycle() {
        Optional<CycleReport> report = tradingCycleService.runCycle();
        Map<String, Object> response = new HashMap<>();
        if (report.isEmpty()) {
            response.put("success", false);
            response.put("message", "A trading cycle is already running");
            return ResponseEntity.status(HttpStatus.CONFLICT).body(response);
        }
        response.put("success", true);
        response.put("report", report.get());
        return ResponseEntity.ok(response);
    }
}
