package com.pivotbot.backend.service.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.pivotbot.backend.model.CycleOutcome;
import com.pivotbot.backend.model.CycleReport;
import com.pivotbot.backend.model.DecisionReason;
import com.pivotbot.backend.model.DecisionState;
import com.pivotbot.backend.model.LimiterStatus;
import com.pivotbot.backend.model.TradeDecision;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonStatusReportRendererTest {

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    private static CycleReport report(CycleOutcome outcome, String price) {
        return CycleReport.builder()
                .timestamp(Instant.parse("2026-10-19T08:00:00Z"))
                .symbol("BTCUSDT")
                .currentPrice(new BigDecimal(price))
                .outcome(outcome)
                .stateBefore(DecisionState.IDLE)
                .stateAfter(DecisionState.IDLE)
                .action(TradeDecision.HOLD)
                .reason(DecisionReason.NO_SIGNAL)
                .limiter(LimiterStatus.builder()
                        .utcDate(LocalDate.of(2026, 10, 19))
                        .tradesExecuted(1)
                        .tradesRemaining(1)
                        .maxTradesPerDay(2)
                        .dailyRealizedPnl(BigDecimal.ZERO)
                        .nextResetAt(Instant.parse("2026-10-20T00:00:00Z"))
                        .persistenceHealthy(true)
                        .build())
                .build();
    }

    @Test
    void render_shouldReplaceReportFileWithLatestCycle() throws Exception {
        Path reportFile = tempDir.resolve("data").resolve("status_report.json");
        JsonStatusReportRenderer renderer = new JsonStatusReportRenderer(objectMapper, reportFile);

        renderer.render(report(CycleOutcome.SKIPPED, "50000"));
        renderer.render(report(CycleOutcome.HOLD, "50100.5"));

        JsonNode json = objectMapper.readTree(reportFile.toFile());
        assertEquals("HOLD", json.get("outcome").asText());
        assertEquals("50100.5", json.get("currentPrice").asText());
        assertEquals("2026-10-19T08:00:00Z", json.get("timestamp").asText());
        assertEquals("2026-10-19", json.at("/limiter/utcDate").asText());
        assertEquals(1, json.at("/limiter/tradesRemaining").asInt());
        try (Stream<Path> files = Files.list(reportFile.getParent())) {
            assertEquals(1, files.count());
        }
    }

    @Test
    void render_whenFileCannotBeWritten_shouldNotThrow() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "regular file");
        JsonStatusReportRenderer renderer = new JsonStatusReportRenderer(objectMapper, blocker.resolve("report.json"));

        renderer.render(report(CycleOutcome.HOLD, "1"));

        assertTrue(Files.isRegularFile(blocker));
        assertFalse(Files.exists(blocker.resolve("report.json")));
    }
}
