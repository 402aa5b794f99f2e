package com.toolfederation.common.trust;

import com.toolfederation.common.model.TrustMetrics;

/**
 * Stateless calculator that converts a server's {@link TrustMetrics} into its 0–100
 * trust score.
 *
 * <p><b>Weighted sub-scores</b>:
 * <pre>
 *   uptime        × 0.20   raw uptime [0, 100]
 *   responseTime  × 0.15   max(0, 100 − avgResponseTimeMs / 100)
 *   successRate   × 0.25   raw success rate [0, 100]
 *   quality       × 0.15   raw quality score [0, 100]
 *   volume        × 0.10   min(100, log10(totalRequests + 1) × 20)
 *   verification  × 0.15   50, +25 verified owner, +25 audited code
 * </pre>
 *
 * <p><b>Report penalty</b>: {@code min(50, reportCount × 10)} is subtracted from the
 * weighted sum. The result is clamped to [0, 100] and rounded half-up.
 */
public final class TrustCalculator {

    static final double UPTIME_WEIGHT        = 0.20;
    static final double RESPONSE_TIME_WEIGHT = 0.15;
    static final double SUCCESS_RATE_WEIGHT  = 0.25;
    static final double QUALITY_WEIGHT       = 0.15;
    static final double VOLUME_WEIGHT        = 0.10;
    static final double VERIFICATION_WEIGHT  = 0.15;

    static final double BASE_VERIFICATION    = 50.0;
    static final double VERIFIED_OWNER_BONUS = 25.0;
    static final double AUDITED_CODE_BONUS   = 25.0;

    static final double PENALTY_PER_REPORT   = 10.0;
    static final double MAX_REPORT_PENALTY   = 50.0;

    public static final int MIN_SCORE = 0;
    public static final int MAX_SCORE = 100;

    private TrustCalculator() {}

    /**
     * @param metrics observed behaviour of one server
     * @return trust score in [0, 100]
     */
    public static int calculate(TrustMetrics metrics) {
        double responseTimeScore = Math.max(0.0, 100.0 - (metrics.avgResponseTimeMs() / 100.0));
        double volumeScore = Math.min(100.0, Math.log10(metrics.totalRequests() + 1) * 20.0);

        double verificationScore = BASE_VERIFICATION;
        if (metrics.verifiedOwner()) verificationScore += VERIFIED_OWNER_BONUS;
        if (metrics.auditedCode())   verificationScore += AUDITED_CODE_BONUS;

        double reportPenalty = Math.min(MAX_REPORT_PENALTY, metrics.reportCount() * PENALTY_PER_REPORT);

        double raw = (metrics.uptime()       * UPTIME_WEIGHT)
                   + (responseTimeScore      * RESPONSE_TIME_WEIGHT)
                   + (metrics.successRate()  * SUCCESS_RATE_WEIGHT)
                   + (metrics.qualityScore() * QUALITY_WEIGHT)
                   + (volumeScore            * VOLUME_WEIGHT)
                   + (verificationScore      * VERIFICATION_WEIGHT)
                   - reportPenalty;

        long rounded = Math.round(raw);
        return (int) Math.max(MIN_SCORE, Math.min(MAX_SCORE, rounded));
    }

    /**
     * Ages a trust score by {@code decayRate} per day of inactivity.
     *
     * @param score             current trust score
     * @param daysSinceActivity days since the server was last seen (fractional allowed)
     * @param decayRate         per-day retention factor, e.g. 0.99
     * @return {@code round(score × decayRate^daysSinceActivity)}
     */
    public static int applyDecay(int score, double daysSinceActivity, double decayRate) {
        double decayFactor = Math.pow(decayRate, daysSinceActivity);
        return (int) Math.round(score * decayFactor);
    }
}
