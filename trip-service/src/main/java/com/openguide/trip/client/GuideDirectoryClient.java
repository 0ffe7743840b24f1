package com.openguide.trip.client;

import com.openguide.trip.client.dto.GuideRatingRequest;
import com.openguide.trip.client.dto.GuideView;
import org.springframework.cloud.openfeign.FeignClient;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;

import java.util.List;

/**
 * Feign client for the guide directory (profiles, availability flag, rating, hourly rate).
 */
@FeignClient(name = "guide-directory", url = "${trip.directories.guide-url:}", path = "/api/v1/guides")
public interface GuideDirectoryClient {

    @GetMapping("/{guideId}")
    GuideView findGuide(@PathVariable("guideId") Long guideId);

    @GetMapping
    List<GuideView> findActiveGuides(@RequestParam("provinceId") Long provinceId,
                                     @RequestParam(value = "language", required = false) String language);

    @PostMapping("/{guideId}/trip-count")
    void incrementTripCount(@PathVariable("guideId") Long guideId);

    @PostMapping("/{guideId}/ratings")
    void submitRating(@PathVariable("guideId") Long guideId, @RequestBody GuideRatingRequest request);
}
