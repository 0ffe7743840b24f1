package com.openguide.trip.domain.model;

public enum ProposalStatus {
    PENDING,
    ACCEPTED,
    REJECTED,
    SUPERSEDED
}
