package com.openguide.trip.domain.service;

import java.util.List;

/**
 * One candidate lookup: the full ranked id list (before distance filtering and paging) and the requested page.
 */
public record CandidateSearch(
        List<Long> candidateGuideIds,
        CandidateGuidesPage page
) {
    public static CandidateSearch empty(CandidateFilter filter) {
        return new CandidateSearch(List.of(), CandidateGuidesPage.empty(filter));
    }
}
