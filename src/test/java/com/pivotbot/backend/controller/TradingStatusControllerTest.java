package com.pivotbot.backend.controller;

import com.pivotbot.backend.model.CycleOutcome;
import com.pivotbot.backend.model.CycleReport;
import com.pivotbot.backend.model.DecisionReason;
import com.pivotbot.backend.model.DecisionState;
import com.pivotbot.backend.model.LimiterStatus;
import com.pivotbot.backend.model.OrderSide;
import com.pivotbot.backend.model.PortfolioSnapshot;
import com.pivotbot.backend.model.TradeDecision;
import com.pivotbot.backend.model.TradeRecord;
import com.pivotbot.backend.service.DecisionEngine;
import com.pivotbot.backend.service.PortfolioLedger;
import com.pivotbot.backend.service.TradeLimiter;
import com.pivotbot.backend.service.TradingCycleService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TradingStatusController.class)
class TradingStatusControllerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");

    @TestConfiguration
    static class FixedClockConfig {
        @Bean
        Clock clock() {
            return Clock.fixed(NOW, ZoneOffset.UTC);
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private TradingCycleService tradingCycleService;

    @MockBean
    private DecisionEngine decisionEngine;

    @MockBean
    private PortfolioLedger ledger;

    @MockBean
    private TradeLimiter tradeLimiter;

    private static PortfolioSnapshot portfolio(List<TradeRecord> trades) {
        return PortfolioSnapshot.builder()
                .balances(Map.of("USDT", new BigDecimal("10020")))
                .realizedPnl(new BigDecimal("20"))
                .unrealizedPnl(BigDecimal.ZERO)
                .portfolioValue(new BigDecimal("10020"))
                .trades(trades)
                .totalTrades(trades.size())
                .winningTrades(1)
                .losingTrades(0)
                .winRate(new BigDecimal("100.00"))
                .largestWin(new BigDecimal("20"))
                .largestLoss(BigDecimal.ZERO)
                .takenAt(NOW)
                .build();
    }

    private static LimiterStatus limiterStatus() {
        return LimiterStatus.builder()
                .utcDate(LocalDate.of(2026, 10, 19))
                .tradesExecuted(2)
                .tradesRemaining(0)
                .maxTradesPerDay(2)
                .dailyRealizedPnl(new BigDecimal("20"))
                .nextResetAt(Instant.parse("2026-10-20T00:00:00Z"))
                .persistenceHealthy(true)
                .build();
    }

    @Test
    void getStatus_shouldReturnStateLimiterAndPnl() throws Exception {
        when(decisionEngine.getState()).thenReturn(DecisionState.IDLE);
        when(ledger.snapshot()).thenReturn(portfolio(List.of()));
        when(tradeLimiter.status(any(Instant.class))).thenReturn(limiterStatus());
        when(tradingCycleService.getLastReport()).thenReturn(CycleReport.builder()
                .timestamp(NOW)
                .symbol("BTCUSDT")
                .outcome(CycleOutcome.HOLD)
                .action(TradeDecision.HOLD)
                .reason(DecisionReason.DAILY_LIMIT)
                .build());

        mockMvc.perform(get("/api/bot/status"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.symbol").value("BTCUSDT"))
                .andExpect(jsonPath("$.state").value("IDLE"))
                .andExpect(jsonPath("$.cycleRunning").value(false))
                .andExpect(jsonPath("$.limiter.tradesRemaining").value(0))
                .andExpect(jsonPath("$.lastCycle.reason").value("DAILY_LIMIT"))
                .andExpect(jsonPath("$.realizedPnl").value(20));
    }

    @Test
    void getTrades_shouldReturnHistoryWithStatistics() throws Exception {
        TradeRecord exit = new TradeRecord(NOW, "BTCUSDT", OrderSide.SELL, new BigDecimal("110"), new BigDecimal("2"),
                new BigDecimal("20"), "sim_2", DecisionReason.TAKE_PROFIT);
        when(ledger.snapshot()).thenReturn(portfolio(List.of(exit)));

        mockMvc.perform(get("/api/bot/trades"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.count").value(1))
                .andExpect(jsonPath("$.trades[0].orderId").value("sim_2"))
                .andExpect(jsonPath("$.trades[0].reason").value("TAKE_PROFIT"))
                .andExpect(jsonPath("$.winRate").value(100.00));
    }

    @Test
    void triggerCycle_whileCycleRunning_shouldReturnConflict() throws Exception {
        when(tradingCycleService.runCycle()).thenReturn(Optional.empty());

        mockMvc.perform(post("/api/bot/cycle"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void triggerCycle_shouldReturnReport() throws Exception {
        when(tradingCycleService.runCycle()).thenReturn(Optional.of(CycleReport.builder()
                .timestamp(NOW)
                .symbol("BTCUSDT")
                .outcome(CycleOutcome.SKIPPED)
                .message("Market data unavailable")
                .build()));

        mockMvc.perform(post("/api/bot/cycle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.report.outcome").value("SKIPPED"));
    }
}
