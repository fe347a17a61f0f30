package com.pivotbot.backend.config;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
@EnableCaching
public class CacheConfig {

    public static final String ADVISOR_RECOMMENDATION_CACHE = "advisorRecommendationCache";

    /**
     * AI recommendations are reused per symbol until the advisor recalculation interval elapses.
     */
    @Bean
    public CacheManager cacheManager(@Value("${advisor.recalculation-interval-seconds:300}") long recalculationSeconds) {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager(ADVISOR_RECOMMENDATION_CACHE);
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .initialCapacity(4)
                .maximumSize(16)
                .expireAfterWrite(recalculationSeconds, TimeUnit.SECONDS)
                .recordStats());
        return cacheManager;
    }
}
