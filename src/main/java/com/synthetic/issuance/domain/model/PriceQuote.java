package com.synthetic.issuance.domain.model;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;

/**
 * Latest answer of a price feed. {@code price} is a USD price at 8-decimal scale.
 */
public record PriceQuote(BigInteger price, Instant updatedAt) {

    public PriceQuote {
        if (price == null) {
            throw new IllegalArgumentException("price must not be null");
        }
        if (updatedAt == null) {
            throw new IllegalArgumentException("updatedAt must not be null");
        }
    }

    public boolean isPositive() {
        return price.signum() > 0;
    }

    public Duration age(Instant now) {
        return Duration.between(updatedAt, now);
    }
}
