package com.pivotbot.backend.service.ai;

import com.pivotbot.backend.config.CacheConfig;
import com.pivotbot.backend.model.AdvisorRecommendation;
import com.pivotbot.backend.model.IndicatorSet;
import com.pivotbot.backend.model.MarketSnapshot;
import com.pivotbot.backend.model.PivotLevels;
import com.pivotbot.backend.model.PortfolioSnapshot;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;

import java.io.IOException;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Produces the advisor recommendation for a cycle. The AI backend is asked once under a hard
 * timeout; whatever goes wrong, the rule-based recommendation is returned instead. This class never throws.
 */
@Service
public class AdvisorBridge {

    private static final Logger logger = LoggerFactory.getLogger(AdvisorBridge.class);

    private final LLMBackend backend;
    private final AdvisorPromptBuilder promptBuilder;
    private final AdvisorResponseParser responseParser;
    private final FallbackRecommendationCalculator fallbackCalculator;
    private final Cache recommendationCache;
    private final boolean enabled;
    private final String model;
    private final long timeoutMs;

    // a request stuck past its timeout must not block the next one
    private final ExecutorService requestExecutor = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r);
        thread.setName("advisor-request");
        thread.setDaemon(true);
        return thread;
    });

    @Autowired
    public AdvisorBridge(LLMBackend backend,
                         AdvisorPromptBuilder promptBuilder,
                         AdvisorResponseParser responseParser,
                         FallbackRecommendationCalculator fallbackCalculator,
                         CacheManager cacheManager,
                         @Value("${advisor.enabled:true}") boolean enabled,
                         @Value("${advisor.ollama.model:mistral}") String model,
                         @Value("${advisor.timeout-ms:120000}") long timeoutMs) {
        this.backend = backend;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.fallbackCalculator = fallbackCalculator;
        this.recommendationCache = cacheManager.getCache(CacheConfig.ADVISOR_RECOMMENDATION_CACHE);
        this.enabled = enabled;
        this.model = model;
        this.timeoutMs = timeoutMs;
        logger.info("Advisor bridge using {} model '{}' (enabled={}, timeout={}ms)",
                backend.getBackendName(), model, enabled, timeoutMs);
    }

    public AdvisorRecommendation getRecommendation(MarketSnapshot snapshot, IndicatorSet indicators,
                                                   PivotLevels pivots, PortfolioSnapshot portfolio) {
        AdvisorRecommendation fallback = fallbackCalculator.calculate(indicators, pivots);
        AdvisorAttempt attempt;
        try {
            attempt = attempt(snapshot, indicators, pivots, portfolio, fallback);
        } catch (RuntimeException e) {
            logger.error("Unexpected advisor failure for {}: {}", snapshot.getSymbol(), e.getMessage(), e);
            attempt = AdvisorAttempt.failure(AdvisorAttempt.FailureKind.BACKEND_ERROR, e.getMessage());
        }

        if (attempt.isSuccess()) {
            return attempt.getRecommendation();
        }
        if (attempt.getFailureKind() == AdvisorAttempt.FailureKind.DISABLED) {
            logger.debug("AI advisor disabled, using rule-based recommendation {}", fallback.getAction());
        } else {
            logger.warn("AI advisor unavailable for {} ({}: {}), using rule-based recommendation {}",
                    snapshot.getSymbol(), attempt.getFailureKind(), attempt.getDetail(), fallback.getAction());
        }
        return fallback;
    }

    AdvisorAttempt attempt(MarketSnapshot snapshot, IndicatorSet indicators, PivotLevels pivots,
                           PortfolioSnapshot portfolio, AdvisorRecommendation fallback) {
        if (!enabled) {
            return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.DISABLED, "advisor.enabled=false");
        }

        String symbol = snapshot.getSymbol();
        AdvisorRecommendation cached = recommendationCache != null
                ? recommendationCache.get(symbol, AdvisorRecommendation.class)
                : null;
        if (cached != null) {
            logger.debug("Reusing cached AI recommendation for {} from {}", symbol, cached.getCreatedAt());
            return AdvisorAttempt.success(cached);
        }

        Future<AdvisorAttempt> future = requestExecutor.submit(() -> {
            if (!backend.isAvailable()) {
                return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.UNAVAILABLE,
                        backend.getBackendName() + " health check failed");
            }
            logger.info("Requesting AI analysis for {} from {}", symbol, backend.getBackendName());
            String prompt = promptBuilder.build(snapshot, indicators, pivots, portfolio);
            String response = backend.complete(prompt, model);
            Optional<AdvisorRecommendation> parsed = responseParser.parse(response, snapshot.getCurrentPrice(), fallback);
            if (parsed.isEmpty()) {
                return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.UNPARSABLE, "no RECOMMENDATION in response");
            }
            return AdvisorAttempt.success(parsed.get());
        });

        try {
            AdvisorAttempt attempt = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (attempt.isSuccess() && recommendationCache != null) {
                logger.info("AI recommendation for {}: {}", symbol, attempt.getRecommendation());
                recommendationCache.put(symbol, attempt.getRecommendation());
            }
            return attempt;
        } catch (TimeoutException e) {
            future.cancel(true);
            return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.TIMEOUT, "no answer within " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.INTERRUPTED, "interrupted while waiting");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof HttpClientErrorException) {
                HttpClientErrorException httpError = (HttpClientErrorException) cause;
                return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.BACKEND_ERROR, "HTTP " + httpError.getStatusCode().value());
            }
            if (cause instanceof IOException) {
                return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.BACKEND_ERROR, cause.getMessage());
            }
            return AdvisorAttempt.failure(AdvisorAttempt.FailureKind.BACKEND_ERROR, cause.toString());
        }
    }

    /** Drops the cached AI recommendation so the next cycle asks the backend again. */
    public void invalidate(String symbol) {
        if (recommendationCache != null) {
            recommendationCache.evict(symbol);
        }
    }

    @PreDestroy
    void shutdown() {
        requestExecutor.shutdownNow();
    }
}
