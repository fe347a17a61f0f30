package com.pivotbot.backend.service.ai;

import com.pivotbot.backend.model.AdvisorRecommendation;

import java.util.Objects;

/**
 * Outcome of one request to the AI backend: either a recommendation or the reason there is none.
 */
public final class AdvisorAttempt {

    public enum FailureKind {
        DISABLED,
        UNAVAILABLE,
        TIMEOUT,
        BACKEND_ERROR,
        UNPARSABLE,
        INTERRUPTED
    }

    private final AdvisorRecommendation recommendation;
    private final FailureKind failureKind;
    private final String detail;

    private AdvisorAttempt(AdvisorRecommendation recommendation, FailureKind failureKind, String detail) {
        this.recommendation = recommendation;
        this.failureKind = failureKind;
        this.detail = detail;
    }

    public static AdvisorAttempt success(AdvisorRecommendation recommendation) {
        return new AdvisorAttempt(Objects.requireNonNull(recommendation), null, null);
    }

    public static AdvisorAttempt failure(FailureKind kind, String detail) {
        return new AdvisorAttempt(null, Objects.requireNonNull(kind), detail);
    }

    public boolean isSuccess() {
        return recommendation != null;
    }

    public AdvisorRecommendation getRecommendation() {
        return recommendation;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return isSuccess() ? "AdvisorAttempt{success}" : "AdvisorAttempt{" + failureKind + ": " + detail + '}';
    }
}
