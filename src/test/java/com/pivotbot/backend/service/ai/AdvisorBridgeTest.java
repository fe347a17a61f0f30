package com.pivotbot.backend.service.ai;

import com.pivotbot.backend.config.CacheConfig;
import com.pivotbot.backend.config.TradingProperties;
import com.pivotbot.backend.model.AdvisorAction;
import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.MarketSnapshot;
import com.pivotbot.backend.model.PivotLevels;
import com.pivotbot.backend.model.PortfolioSnapshot;
import com.pivotbot.backend.model.RecommendationSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.http.HttpStatus;
import org.springframework.web.client.HttpClientErrorException;

import java.io.IOException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static com.pivotbot.backend.support.Recommendations.neutralIndicators;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AdvisorBridgeTest {

    private static final Instant NOW = Instant.parse("2026-10-19T08:00:00Z");
    private static final BigDecimal PRICE = new BigDecimal("50000");
    private static final PivotLevels PIVOTS = new PivotLevels(new BigDecimal("50000"), new BigDecimal("51000"),
            new BigDecimal("52000"), new BigDecimal("49000"), new BigDecimal("48000"));
    private static final String AI_ANSWER = "RECOMMENDATION: BUY\nCONFIDENCE: 75%\nSTOP_LOSS: $48,800\n"
            + "TAKE_PROFIT: $53,500\nREASONING: Bounce off S1.";

    @Mock
    private LLMBackend backend;

    private final MarketSnapshot snapshot = new MarketSnapshot("BTCUSDT", List.of(), List.of(), List.of(), PRICE, NOW);
    private final PortfolioSnapshot portfolio = PortfolioSnapshot.builder()
            .balances(Map.of("USDT", new BigDecimal("10000")))
            .build();

    private AdvisorBridge bridge;

    @BeforeEach
    void setUp() {
        lenient().when(backend.getBackendName()).thenReturn("OLLAMA");
        bridge = newBridge(true, 2_000);
    }

    @AfterEach
    void tearDown() {
        bridge.shutdown();
    }

    private AdvisorBridge newBridge(boolean enabled, long timeoutMs) {
        TradingProperties properties = new TradingProperties();
        return new AdvisorBridge(backend,
                new AdvisorPromptBuilder(properties),
                new AdvisorResponseParser(new BigDecimal("0.20"), new BigDecimal("0.30")),
                new FallbackRecommendationCalculator(properties, Clock.fixed(NOW, ZoneOffset.UTC)),
                new CaffeineCacheManager(CacheConfig.ADVISOR_RECOMMENDATION_CACHE),
                enabled, "mistral", timeoutMs);
    }

    private AdvisorRecommendation ask() {
        return bridge.getRecommendation(snapshot, neutralIndicators(), PIVOTS, portfolio);
    }

    @Test
    void getRecommendation_withValidAnswer_shouldUseAiAndCacheIt() throws Exception {
        when(backend.isAvailable()).thenReturn(true);
        when(backend.complete(contains("MARKET DATA FOR BTCUSDT"), eq("mistral"))).thenReturn(AI_ANSWER);

        AdvisorRecommendation first = ask();
        AdvisorRecommendation second = ask();

        assertEquals(RecommendationSource.AI, first.getSource());
        assertEquals(AdvisorAction.BUY, first.getAction());
        assertEquals(0, new BigDecimal("48800").compareTo(first.getStopLoss()));
        // missing targets come from the pivot levels
        assertEquals(0, new BigDecimal("49000").compareTo(first.getBuyTarget()));
        assertEquals(first, second);
        verify(backend, times(1)).complete(anyString(), anyString());
    }

    @Test
    void invalidate_shouldForceNewRequest() throws Exception {
        when(backend.isAvailable()).thenReturn(true);
        when(backend.complete(anyString(), anyString())).thenReturn(AI_ANSWER);

        ask();
        bridge.invalidate("BTCUSDT");
        ask();

        verify(backend, times(2)).complete(anyString(), anyString());
    }

    @Test
    void getRecommendation_whenDisabled_shouldNotContactBackend() throws Exception {
        bridge.shutdown();
        bridge = newBridge(false, 2_000);

        AdvisorRecommendation recommendation = ask();

        assertEquals(RecommendationSource.FALLBACK, recommendation.getSource());
        verify(backend, never()).isAvailable();
        verify(backend, never()).complete(anyString(), anyString());
    }

    @Test
    void getRecommendation_whenHealthCheckFails_shouldFallBack() throws Exception {
        when(backend.isAvailable()).thenReturn(false);

        AdvisorRecommendation recommendation = ask();

        assertEquals(RecommendationSource.FALLBACK, recommendation.getSource());
        assertEquals(0, PIVOTS.getSupport2().compareTo(recommendation.getStopLoss()));
        verify(backend, never()).complete(anyString(), anyString());
    }

    @Test
    void attempt_whenBackendIsSlow_shouldTimeOut() throws Exception {
        bridge.shutdown();
        bridge = newBridge(true, 100);
        when(backend.isAvailable()).thenReturn(true);
        when(backend.complete(anyString(), anyString())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return AI_ANSWER;
        });

        long started = System.nanoTime();
        AdvisorAttempt attempt = bridge.attempt(snapshot, neutralIndicators(), PIVOTS, portfolio,
                new FallbackRecommendationCalculator(new TradingProperties(), Clock.systemUTC())
                        .calculate(neutralIndicators(), PIVOTS));
        long elapsedMs = (System.nanoTime() - started) / 1_000_000;

        assertEquals(AdvisorAttempt.FailureKind.TIMEOUT, attempt.getFailureKind());
        assertTrue(elapsedMs < 4_000, "waited " + elapsedMs + "ms");
    }

    @Test
    void getRecommendation_withUnparsableAnswer_shouldFallBackWithoutCaching() throws Exception {
        when(backend.isAvailable()).thenReturn(true);
        when(backend.complete(anyString(), anyString())).thenReturn("The market looks interesting today.");

        AdvisorRecommendation recommendation = ask();
        ask();

        assertEquals(RecommendationSource.FALLBACK, recommendation.getSource());
        verify(backend, times(2)).complete(anyString(), anyString());
    }

    @Test
    void getRecommendation_whenBackendFails_shouldFallBack() throws Exception {
        when(backend.isAvailable()).thenReturn(true);
        when(backend.complete(anyString(), anyString()))
                .thenThrow(new IOException("connection reset"))
                .thenThrow(new HttpClientErrorException(HttpStatus.TOO_MANY_REQUESTS));

        assertEquals(RecommendationSource.FALLBACK, ask().getSource());
        assertEquals(RecommendationSource.FALLBACK, ask().getSource());
    }
}
