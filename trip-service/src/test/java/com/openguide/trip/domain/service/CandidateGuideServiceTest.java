package com.openguide.trip.domain.service;

import com.openguide.trip.client.DirectoryGateway;
import com.openguide.trip.client.dto.GuideView;
import com.openguide.trip.domain.model.GeoPoint;
import com.openguide.trip.domain.model.PaymentStatus;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.store.InMemoryTripStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CandidateGuideServiceTest {

    private static final Long PROVINCE_ID = 5L;

    @Mock
    private DirectoryGateway directoryGateway;

    private InMemoryTripStore tripStore;
    private CandidateGuideService candidateGuideService;

    @BeforeEach
    void setUp() {
        tripStore = new InMemoryTripStore();
        candidateGuideService = new CandidateGuideService(tripStore, directoryGateway);
        ReflectionTestUtils.setField(candidateGuideService, "defaultMaxDistanceKm", 50.0);
    }

    @Test
    @DisplayName("Active guides of the province, best rated first, and the list is cached on the trip")
    void ranksAndCaches() {
        // given
        Trip trip = tripStore.put(trip(TripStatus.SELECTING_GUIDE, null));
        when(directoryGateway.findActiveGuides(PROVINCE_ID, null)).thenReturn(List.of(
                guide(1L, 4.1, true, 21.0, 105.8),
                guide(2L, null, true, 21.0, 105.8),
                guide(3L, 4.9, true, 21.0, 105.8),
                guide(4L, 5.0, false, 21.0, 105.8)));

        // when
        CandidateGuidesPage page = candidateGuideService.listCandidateGuides(trip.getId(), CandidateFilter.defaults());

        // then
        assertThat(page.guides()).extracting(c -> c.guide().id()).containsExactly(3L, 1L, 2L);
        assertThat(page.guides()).allSatisfy(c -> assertThat(c.distanceKm()).isNull());
        assertThat(page.total()).isEqualTo(3);
        assertThat(page.limit()).isEqualTo(20);
        assertThat(tripStore.findById(trip.getId()).orElseThrow().getCandidateGuideIds()).containsExactly(3L, 1L, 2L);
    }

    @Test
    @DisplayName("Meeting point filters guides by flat-degree distance but the cache keeps them all")
    void distanceFilter() {
        // given
        Trip trip = tripStore.put(trip(TripStatus.SELECTING_GUIDE, new GeoPoint(21.0, 105.8)));
        when(directoryGateway.findActiveGuides(PROVINCE_ID, "en")).thenReturn(List.of(
                guide(1L, 4.0, true, 21.1, 105.8),
                guide(2L, 4.5, true, 22.0, 105.8),
                guide(3L, 4.8, true, null, null)));

        // when
        CandidateGuidesPage page = candidateGuideService.listCandidateGuides(trip.getId(),
                new CandidateFilter("en", 20.0, null, null));

        // then
        assertThat(page.guides()).singleElement().satisfies(c -> {
            assertThat(c.guide().id()).isEqualTo(1L);
            assertThat(c.distanceKm()).isCloseTo(11.1, within(0.01));
        });
        assertThat(tripStore.findById(trip.getId()).orElseThrow().getCandidateGuideIds()).containsExactly(3L, 2L, 1L);
    }

    @Test
    @DisplayName("Pages are one-based and report the full total")
    void paging() {
        // given
        Trip trip = tripStore.put(trip(TripStatus.AWAITING_CALL, null));
        when(directoryGateway.findActiveGuides(PROVINCE_ID, null)).thenReturn(List.of(
                guide(1L, 5.0, true, null, null),
                guide(2L, 4.0, true, null, null),
                guide(3L, 3.0, true, null, null)));

        // when
        CandidateGuidesPage second = candidateGuideService.listCandidateGuides(trip.getId(),
                new CandidateFilter(null, null, 2, 2));

        // then
        assertThat(second.guides()).extracting(c -> c.guide().id()).containsExactly(3L);
        assertThat(second.total()).isEqualTo(3);
        assertThat(second.totalPages()).isEqualTo(2);
    }

    @Test
    @DisplayName("A page far past the end is empty, not an error")
    void pageFarPastTheEnd() {
        // given
        Trip trip = tripStore.put(trip(TripStatus.SELECTING_GUIDE, null));
        when(directoryGateway.findActiveGuides(PROVINCE_ID, null)).thenReturn(List.of(guide(1L, 4.0, true, null, null)));

        // when
        CandidateGuidesPage page = candidateGuideService.listCandidateGuides(trip.getId(),
                new CandidateFilter(null, null, Integer.MAX_VALUE, null));

        // then
        assertThat(page.guides()).isEmpty();
        assertThat(page.page()).isEqualTo(Integer.MAX_VALUE);
        assertThat(page.total()).isEqualTo(1);
    }

    @Test
    @DisplayName("A failed candidate cache write still returns the page")
    void cacheWriteFailure() {
        // given
        Trip trip = tripStore.put(trip(TripStatus.SELECTING_GUIDE, null));
        when(directoryGateway.findActiveGuides(PROVINCE_ID, null)).thenReturn(List.of(guide(1L, 4.0, true, null, null)));
        tripStore.beforeUpdate(() -> {
            throw new IllegalStateException("connection reset");
        });

        // when
        CandidateGuidesPage page = candidateGuideService.listCandidateGuides(trip.getId(), CandidateFilter.defaults());

        // then
        assertThat(page.guides()).extracting(c -> c.guide().id()).containsExactly(1L);
        assertThat(tripStore.findById(trip.getId()).orElseThrow().getCandidateGuideIds()).isEmpty();
    }

    @Test
    @DisplayName("Search ranks guides without writing the trip")
    void searchDoesNotWrite() {
        // given
        Trip trip = tripStore.put(trip(TripStatus.SELECTING_GUIDE, null));
        when(directoryGateway.findActiveGuides(PROVINCE_ID, null)).thenReturn(List.of(
                guide(1L, 3.0, true, null, null),
                guide(2L, 4.5, true, null, null)));

        // when
        CandidateSearch search = candidateGuideService.search(trip, CandidateFilter.defaults());

        // then
        assertThat(search.candidateGuideIds()).containsExactly(2L, 1L);
        assertThat(search.page().total()).isEqualTo(2);
        assertThat(tripStore.findById(trip.getId()).orElseThrow().getCandidateGuideIds()).isEmpty();
    }

    @Test
    @DisplayName("Trip past guide selection gets an empty page without a directory call")
    void tripPastSelection() {
        Trip trip = tripStore.put(trip(TripStatus.CONFIRMED, null));

        CandidateGuidesPage page = candidateGuideService.listCandidateGuides(trip.getId(), CandidateFilter.defaults());

        assertThat(page.guides()).isEmpty();
        assertThat(page.total()).isZero();
        verifyNoInteractions(directoryGateway);
    }

    private static Trip trip(TripStatus status, GeoPoint meetingPoint) {
        Instant startAt = Instant.parse("2026-03-05T02:00:00Z");
        return Trip.builder()
                .touristId(1L)
                .provinceId(PROVINCE_ID)
                .startAt(startAt)
                .endAt(startAt.plusSeconds(4 * 3600))
                .currency("usd")
                .paymentStatus(PaymentStatus.UNPAID)
                .meetingPoint(meetingPoint)
                .status(status)
                .build();
    }

    private static GuideView guide(Long id, Double rating, boolean active, Double latitude, Double longitude) {
        return new GuideView(id, id * 10, "Guide " + id, active, new BigDecimal("15"), List.of("en"),
                rating, latitude, longitude, 0);
    }
}
