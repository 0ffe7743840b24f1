package com.openguide.trip.api.dto;

import com.openguide.trip.domain.service.CandidateGuide;
import com.openguide.trip.domain.service.CandidateGuidesPage;

import java.math.BigDecimal;
import java.util.List;

public record CandidateGuidesResponse(
        List<Guide> guides,
        int page,
        int limit,
        int total,
        int totalPages
) {
    public record Guide(Long id, String name, BigDecimal pricePerHour, List<String> languages, Double rating,
                        Integer totalTrips, Double distanceKm) {
        static Guide from(CandidateGuide candidate) {
            return new Guide(candidate.guide().id(), candidate.guide().name(), candidate.guide().pricePerHour(),
                    candidate.guide().languages(), candidate.guide().rating(), candidate.guide().totalTrips(),
                    candidate.distanceKm());
        }
    }

    public static CandidateGuidesResponse from(CandidateGuidesPage page) {
        return new CandidateGuidesResponse(
                page.guides().stream().map(Guide::from).toList(),
                page.page(),
                page.limit(),
                page.total(),
                page.totalPages()
        );
    }
}
