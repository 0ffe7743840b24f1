package com.openguide.trip.client;

import com.openguide.common.exception.ServiceUnavailableException;
import com.openguide.trip.client.dto.GuideRatingRequest;
import com.openguide.trip.client.dto.GuideView;
import com.openguide.trip.client.dto.PlaceView;
import com.openguide.trip.client.dto.UserView;
import feign.FeignException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Read access to the guide, user and place directories with retry and circuit breaking.
 * A 404 from a directory is an empty result; any other failure surfaces as {@link ServiceUnavailableException}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DirectoryGateway {

    private final GuideDirectoryClient guideClient;
    private final UserDirectoryClient userClient;
    private final PlaceDirectoryClient placeClient;

    @Retry(name = "directory")
    @CircuitBreaker(name = "directory", fallbackMethod = "guideUnavailable")
    public Optional<GuideView> findGuide(Long guideId) {
        try {
            return Optional.ofNullable(guideClient.findGuide(guideId));
        } catch (FeignException.NotFound e) {
            return Optional.empty();
        }
    }

    @Retry(name = "directory")
    @CircuitBreaker(name = "directory", fallbackMethod = "guidesUnavailable")
    public List<GuideView> findActiveGuides(Long provinceId, String language) {
        List<GuideView> guides = guideClient.findActiveGuides(provinceId, language);
        return guides != null ? guides : List.of();
    }

    @Retry(name = "directory")
    @CircuitBreaker(name = "directory", fallbackMethod = "userUnavailable")
    public Optional<UserView> findUser(Long userId) {
        try {
            return Optional.ofNullable(userClient.findUser(userId));
        } catch (FeignException.NotFound e) {
            return Optional.empty();
        }
    }

    @Retry(name = "directory")
    @CircuitBreaker(name = "directory", fallbackMethod = "placeUnavailable")
    public Optional<PlaceView> findPlace(Long placeId) {
        try {
            return Optional.ofNullable(placeClient.findPlace(placeId));
        } catch (FeignException.NotFound e) {
            return Optional.empty();
        }
    }

    @Retry(name = "directory")
    public void incrementGuideTripCount(Long guideId) {
        guideClient.incrementTripCount(guideId);
    }

    @Retry(name = "directory")
    public void submitGuideRating(Long guideId, UUID tripId, int rating) {
        guideClient.submitRating(guideId, new GuideRatingRequest(tripId, rating));
    }

    private Optional<GuideView> guideUnavailable(Long guideId, Throwable t) {
        log.error("Guide directory unavailable while loading guide {}", guideId, t);
        throw new ServiceUnavailableException("Guide directory is temporarily unavailable", t);
    }

    private List<GuideView> guidesUnavailable(Long provinceId, String language, Throwable t) {
        log.error("Guide directory unavailable while listing province {}", provinceId, t);
        throw new ServiceUnavailableException("Guide directory is temporarily unavailable", t);
    }

    private Optional<UserView> userUnavailable(Long userId, Throwable t) {
        log.error("User directory unavailable while loading user {}", userId, t);
        throw new ServiceUnavailableException("User directory is temporarily unavailable", t);
    }

    private Optional<PlaceView> placeUnavailable(Long placeId, Throwable t) {
        log.error("Place directory unavailable while loading place {}", placeId, t);
        throw new ServiceUnavailableException("Place directory is temporarily unavailable", t);
    }
}
