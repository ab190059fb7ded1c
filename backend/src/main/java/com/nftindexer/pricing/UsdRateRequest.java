package com.nftindexer.pricing;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Request for the USD value of one whole unit of a currency on the UTC day of {@code timestamp}.
 */
@NoArgsConstructor
@Getter
@Setter
public class UsdRateRequest {

    private String currency;
    private Instant timestamp;

    public UsdRateRequest(String currency, Instant timestamp) {
        this.currency = currency;
        this.timestamp = timestamp;
    }

    public LocalDate getDate() {
        return timestamp == null ? null : timestamp.atOffset(ZoneOffset.UTC).toLocalDate();
    }
}
