package com.openguide.trip.domain.service;

import java.util.List;

public record CandidateGuidesPage(
        List<CandidateGuide> guides,
        int page,
        int limit,
        int total
) {
    public static CandidateGuidesPage empty(CandidateFilter filter) {
        return new CandidateGuidesPage(List.of(), filter.effectivePage(), filter.effectiveLimit(), 0);
    }

    public int totalPages() {
        return limit == 0 ? 0 : (total + limit - 1) / limit;
    }
}
