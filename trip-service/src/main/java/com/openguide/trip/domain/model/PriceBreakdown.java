package com.openguide.trip.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * guideFee + tickets + serviceFee = total, each rounded to cents.
 */
@Embeddable
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PriceBreakdown {

    @Column(name = "price_guide_fee", precision = 10, scale = 2)
    private BigDecimal guideFee;

    @Column(name = "price_tickets", precision = 10, scale = 2)
    private BigDecimal tickets;

    @Column(name = "price_service_fee", precision = 10, scale = 2)
    private BigDecimal serviceFee;

    @Column(name = "price_total", precision = 10, scale = 2)
    private BigDecimal total;
}
