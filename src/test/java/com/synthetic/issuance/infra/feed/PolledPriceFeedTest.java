package com.synthetic.issuance.infra.feed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class PolledPriceFeedTest {

    private final PolledPriceFeed feed = new PolledPriceFeed("ethusdt");

    @Test
    @DisplayName("before the first poll the feed answers zero at the epoch")
    void noAnswerYet() {
        assertEquals(BigInteger.ZERO, feed.latestQuote().price());
        assertEquals(Instant.EPOCH, feed.latestQuote().updatedAt());
        assertFalse(feed.latestQuote().isPositive());
        assertEquals("ETHUSDT", feed.marketSymbol());
    }

    @Test
    @DisplayName("decimal price is scaled to 8 decimals, extra digits truncated")
    void scalesToFeedDecimals() {
        Instant t = Instant.parse("2026-01-01T00:00:00Z");

        assertTrue(feed.update(new BigDecimal("2001.123456789"), t));

        assertEquals(new BigInteger("200112345678"), feed.latestQuote().price());
        assertEquals(t, feed.latestQuote().updatedAt());
        assertEquals(8, PolledPriceFeed.FEED_DECIMALS);
    }

    @Test
    @DisplayName("older answers are ignored")
    void ignoresOlderAnswers() {
        Instant t = Instant.parse("2026-01-01T00:00:00Z");
        feed.update(new BigDecimal("2000"), t);

        assertFalse(feed.update(new BigDecimal("1000"), t.minusSeconds(1)));
        assertTrue(feed.update(new BigDecimal("2100"), t));

        assertEquals(new BigInteger("210000000000"), feed.latestQuote().price());
    }
}
