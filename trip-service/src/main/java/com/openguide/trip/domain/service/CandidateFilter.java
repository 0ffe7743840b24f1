package com.openguide.trip.domain.service;

import com.openguide.common.util.Constants;

/**
 * Candidate guide query. Null fields fall back to defaults; page is 1-based.
 */
public record CandidateFilter(
        String language,
        Double maxDistanceKm,
        Integer page,
        Integer limit
) {
    public static CandidateFilter defaults() {
        return new CandidateFilter(null, null, null, null);
    }

    public int effectivePage() {
        return page == null || page < 1 ? 1 : page;
    }

    public int effectiveLimit() {
        if (limit == null || limit < 1) {
            return Constants.DEFAULT_PAGE_SIZE;
        }
        return Math.min(limit, Constants.MAX_PAGE_SIZE);
    }
}
