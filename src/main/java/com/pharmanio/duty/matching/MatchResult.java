package com.pharmanio.duty.matching;

import java.util.Optional;

/**
 * Outcome of matching one raw listing. {@code bestRatio} is kept for rejected matches as well so
 * false negatives can be audited from the logs.
 */
public record MatchResult(MatchStatus status, String rawName, String city, Long pharmacyId, double bestRatio) {

    public static MatchResult matched(String rawName, String city, long pharmacyId, double ratio) {
        return new MatchResult(MatchStatus.MATCHED, rawName, city, pharmacyId, ratio);
    }

    public static MatchResult noConfidentMatch(String rawName, String city, double bestRatio) {
        return new MatchResult(MatchStatus.NO_CONFIDENT_MATCH, rawName, city, null, bestRatio);
    }

    public static MatchResult noCityCoverage(String rawName, String city) {
        return new MatchResult(MatchStatus.NO_CITY_COVERAGE, rawName, city, null, 0.0);
    }

    public static MatchResult skipped(String rawName, String city) {
        return new MatchResult(MatchStatus.SKIPPED_INCOMPLETE, rawName, city, null, 0.0);
    }

    public boolean isMatched() {
        return status == MatchStatus.MATCHED;
    }

    public Optional<Long> matchedId() {
        return Optional.ofNullable(pharmacyId);
    }
}
