package com.pivotbot.backend.model;

public enum RecommendationSource {
    AI,
    FALLBACK
}
