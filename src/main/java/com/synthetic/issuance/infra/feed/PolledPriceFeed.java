package com.synthetic.issuance.infra.feed;

import com.synthetic.issuance.domain.model.PriceQuote;
import com.synthetic.issuance.domain.token.PriceFeed;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Price feed backed by the last successful poll of a market symbol. Until the first poll lands the
 * feed answers a zero price dated at the epoch, which the strict oracle path rejects.
 */
public class PolledPriceFeed implements PriceFeed {

    static final int FEED_DECIMALS = 8;

    private static final PriceQuote NO_ANSWER = new PriceQuote(BigInteger.ZERO, Instant.EPOCH);

    private final String marketSymbol;
    private final AtomicReference<PriceQuote> latest = new AtomicReference<>(NO_ANSWER);

    public PolledPriceFeed(String marketSymbol) {
        this.marketSymbol = marketSymbol.toUpperCase();
    }

    public String marketSymbol() {
        return marketSymbol;
    }

    @Override
    public PriceQuote latestQuote() {
        return latest.get();
    }

    @Override
    public String description() {
        return marketSymbol + " mark price / " + FEED_DECIMALS + " decimals";
    }

    /** Ignores answers older than the one already held. */
    public boolean update(BigDecimal price, Instant updatedAt) {
        BigInteger scaled = price.setScale(FEED_DECIMALS, RoundingMode.DOWN).unscaledValue();
        PriceQuote candidate = new PriceQuote(scaled, updatedAt);
        PriceQuote current;
        do {
            current = latest.get();
            if (current.updatedAt().isAfter(updatedAt)) return false;
        } while (!latest.compareAndSet(current, candidate));
        return true;
    }
}
