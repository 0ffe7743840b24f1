package com.openguide.trip.domain.repository;

import com.openguide.trip.config.ClockConfig;
import com.openguide.trip.domain.model.CallRecord;
import com.openguide.trip.domain.model.ItineraryStop;
import com.openguide.trip.domain.model.PaymentStatus;
import com.openguide.trip.domain.model.Trip;
import com.openguide.trip.domain.model.TripStatus;
import com.openguide.trip.domain.store.JpaTripStore;
import com.openguide.trip.domain.store.TripPatch;
import com.openguide.trip.domain.store.UpdateResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * The status compare-and-swap and the calendar query against a real PostgreSQL.
 * Only the JPA layer is loaded; no Kafka, Redis or Feign.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@EntityScan("com.openguide.trip.domain.model")
@Import({JpaTripStore.class, ClockConfig.class})
@Testcontainers(disabledWithoutDocker = true)
class TripRepositoryIntegrationTest {

    private static final Instant START = Instant.parse("2026-05-01T02:00:00Z");

    @Container
    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("trip_db")
            .withUsername("postgres")
            .withPassword("postgres");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("spring.jpa.hibernate.ddl-auto", () -> "create");
    }

    @Autowired
    private TripRepository tripRepository;

    @Autowired
    private JpaTripStore tripStore;

    @Test
    @DisplayName("Status CAS succeeds once; a second writer on the same expected status sees 0 rows")
    void compareAndSetStatus_singleWinner() {
        // given
        UUID tripId = tripRepository.saveAndFlush(trip(TripStatus.SELECTING_GUIDE, null, START)).getId();

        // when
        int first = tripRepository.compareAndSetStatus(tripId, TripStatus.SELECTING_GUIDE, TripStatus.AWAITING_CALL, Instant.now());
        int second = tripRepository.compareAndSetStatus(tripId, TripStatus.SELECTING_GUIDE, TripStatus.CANCELLED, Instant.now());

        // then
        assertThat(first).isEqualTo(1);
        assertThat(second).isZero();
        assertThat(tripRepository.findById(tripId).orElseThrow().getStatus()).isEqualTo(TripStatus.AWAITING_CALL);
    }

    @Test
    @DisplayName("Store applies the patch after the CAS and keeps element collections intact")
    void updateIfStatus_appliesPatch() {
        // given
        Trip trip = trip(TripStatus.AWAITING_CALL, 7L, START);
        trip.getItinerary().add(ItineraryStop.builder().placeId(3L).visitDurationMinutes(60).build());
        UUID tripId = tripStore.create(trip).getId();
        UUID callId = UUID.randomUUID();

        // when
        UpdateResult result = tripStore.updateIfStatus(tripId, TripStatus.AWAITING_CALL,
                TripPatch.transitionTo(TripStatus.IN_CALL).with(t -> t.getCallRecords().add(CallRecord.builder()
                        .callId(callId)
                        .guideId(7L)
                        .startedAt(Instant.now())
                        .build())));
        UpdateResult stale = tripStore.updateIfStatus(tripId, TripStatus.AWAITING_CALL,
                TripPatch.transitionTo(TripStatus.CANCELLED));

        // then
        assertThat(result.updated()).isTrue();
        assertThat(stale.updated()).isFalse();
        assertThat(stale.trip().getStatus()).isEqualTo(TripStatus.IN_CALL);
        Trip reloaded = tripStore.findById(tripId).orElseThrow();
        assertThat(reloaded.getStatus()).isEqualTo(TripStatus.IN_CALL);
        assertThat(reloaded.getCallRecords()).extracting(CallRecord::getCallId).containsExactly(callId);
        assertThat(reloaded.getItinerary()).extracting(ItineraryStop::getPlaceId).containsExactly(3L);
    }

    @Test
    @DisplayName("Overlap query treats intervals as half-open and filters by status")
    void findOverlapping() {
        // given
        tripRepository.saveAndFlush(trip(TripStatus.CONFIRMED, 7L, START));
        tripRepository.saveAndFlush(trip(TripStatus.CANCELLED, 7L, START.plusSeconds(3600)));
        tripRepository.saveAndFlush(trip(TripStatus.IN_PROGRESS, 8L, START));
        EnumSet<TripStatus> active = EnumSet.of(TripStatus.CONFIRMED, TripStatus.IN_PROGRESS);

        // when
        List<Trip> inside = tripRepository.findOverlapping(7L, START.plusSeconds(1800), START.plusSeconds(7200), active);
        List<Trip> touching = tripRepository.findOverlapping(7L, START.plusSeconds(4 * 3600), START.plusSeconds(6 * 3600), active);

        // then
        assertThat(inside).hasSize(1);
        assertThat(touching).isEmpty();
    }

    private static Trip trip(TripStatus status, Long guideId, Instant startAt) {
        return Trip.builder()
                .touristId(1L)
                .selectedGuideId(guideId)
                .provinceId(5L)
                .startAt(startAt)
                .totalDurationMinutes(240)
                .endAt(startAt.plusSeconds(4 * 3600))
                .negotiatedPrice(new BigDecimal("90.00"))
                .currency("usd")
                .paymentStatus(PaymentStatus.UNPAID)
                .status(status)
                .createdAt(START.minusSeconds(86_400))
                .build();
    }
}
