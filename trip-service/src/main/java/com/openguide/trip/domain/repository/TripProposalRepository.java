package com.openguide.trip.domain.repository;

import com.openguide.trip.domain.model.TripProposal;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface TripProposalRepository extends JpaRepository<TripProposal, UUID> {
    List<TripProposal> findByTripIdOrderByCreatedAtDesc(UUID tripId);
}
