package com.toolfederation.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Observed behaviour of a single federated server, consumed by
 * {@link com.toolfederation.common.trust.TrustCalculator}.
 *
 * <ul>
 *   <li>{@code uptime} – health-probe derived availability ([0, 100]).</li>
 *   <li>{@code avgResponseTimeMs} – rolling mean latency of successful tool calls.</li>
 *   <li>{@code successRate} – {@code (totalRequests - totalErrors) / totalRequests * 100}.</li>
 *   <li>{@code qualityScore} – response quality ([0, 100]); starts neutral at 50.</li>
 *   <li>{@code reportCount} – number of abuse reports filed against the server.</li>
 *   <li>{@code verifiedOwner}, {@code auditedCode} – verification flags.</li>
 * </ul>
 */
public record TrustMetrics(
    @JsonProperty("uptime")            double uptime,
    @JsonProperty("avgResponseTimeMs") double avgResponseTimeMs,
    @JsonProperty("successRate")       double successRate,
    @JsonProperty("totalRequests")     long   totalRequests,
    @JsonProperty("totalErrors")       long   totalErrors,
    @JsonProperty("qualityScore")      double qualityScore,
    @JsonProperty("reportCount")       int    reportCount,
    @JsonProperty("verifiedOwner")     boolean verifiedOwner,
    @JsonProperty("auditedCode")       boolean auditedCode
) {
    /** Metrics every server starts with at registration. */
    public static TrustMetrics defaults() {
        return new TrustMetrics(100.0, 0.0, 100.0, 0, 0, 50.0, 0, false, false);
    }

    public TrustMetrics withUptime(double value) {
        return new TrustMetrics(value, avgResponseTimeMs, successRate, totalRequests, totalErrors,
            qualityScore, reportCount, verifiedOwner, auditedCode);
    }

    public TrustMetrics withRequests(long requests, long errors, double avgResponseMs, double rate) {
        return new TrustMetrics(uptime, avgResponseMs, rate, requests, errors,
            qualityScore, reportCount, verifiedOwner, auditedCode);
    }

    public TrustMetrics withReportCount(int count) {
        return new TrustMetrics(uptime, avgResponseTimeMs, successRate, totalRequests, totalErrors,
            qualityScore, count, verifiedOwner, auditedCode);
    }

    public TrustMetrics withVerifiedOwner(boolean verified) {
        return new TrustMetrics(uptime, avgResponseTimeMs, successRate, totalRequests, totalErrors,
            qualityScore, reportCount, verified, auditedCode);
    }

    public TrustMetrics withAuditedCode(boolean audited) {
        return new TrustMetrics(uptime, avgResponseTimeMs, successRate, totalRequests, totalErrors,
            qualityScore, reportCount, verifiedOwner, audited);
    }
}
