package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.OracleException;
import com.synthetic.issuance.domain.error.ValidationException;
import com.synthetic.issuance.domain.model.PriceQuote;
import com.synthetic.issuance.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Duration;

import static com.synthetic.issuance.support.EngineFixture.NOW;
import static com.synthetic.issuance.support.EngineFixture.ether;
import static org.junit.jupiter.api.Assertions.*;

class PriceOracleAdapterTest {

    private final EngineFixture f = new EngineFixture();
    private final PriceOracleAdapter oracle = f.oracle;

    @Test
    @DisplayName("token → usd → token loses at most one wei")
    void roundTrip() {
        f.wethFeed.setQuote(new PriceQuote(new BigInteger("178912345678"), NOW));
        BigInteger amount = new BigInteger("123456789012345678901");

        BigInteger usd = oracle.usdValue("WETH", amount);
        BigInteger back = oracle.tokenAmountFromUsd("WETH", usd, NOW);

        assertTrue(back.compareTo(amount) <= 0);
        assertTrue(amount.subtract(back).compareTo(BigInteger.ONE) <= 0, "lost " + amount.subtract(back));
    }

    @Test
    @DisplayName("usdValue does not check freshness or sign")
    void usdValueUnchecked() {
        f.wethFeed.setQuote(new PriceQuote(BigInteger.valueOf(-1), NOW.minus(Duration.ofDays(30))));
        assertEquals(BigInteger.valueOf(-10_000_000_000L), oracle.usdValue("WETH", ether(1)));
    }

    @Test
    @DisplayName("negative price → INVALID_PRICE and a rejection is counted")
    void negativePrice() {
        f.wethFeed.setQuote(new PriceQuote(BigInteger.valueOf(-1), NOW));

        OracleException e = assertThrows(OracleException.class,
                () -> oracle.tokenAmountFromUsd("WETH", ether(1), NOW));

        assertEquals(ErrorCode.INVALID_PRICE, e.getCode());
        assertEquals(1.0, f.counter("oracle.rejections", "reason", "invalid_price"));
    }

    @Test
    @DisplayName("staleness is measured against the supplied instant")
    void stalenessUsesSuppliedNow() {
        f.wethFeed.setPrice(2_000, NOW);

        assertDoesNotThrow(() -> oracle.tokenAmountFromUsd("WETH", ether(1), NOW.plus(Duration.ofHours(3))));
        OracleException e = assertThrows(OracleException.class,
                () -> oracle.tokenAmountFromUsd("WETH", ether(1), NOW.plus(Duration.ofHours(3)).plusSeconds(1)));
        assertEquals(ErrorCode.STALE_PRICE, e.getCode());
        assertEquals(1.0, f.counter("oracle.rejections", "reason", "stale_price"));
    }

    @Test
    @DisplayName("unregistered asset → TOKEN_NOT_ALLOWED")
    void unknownAsset() {
        ValidationException e = assertThrows(ValidationException.class, () -> oracle.usdValue("LINK", ether(1)));
        assertEquals(ErrorCode.TOKEN_NOT_ALLOWED, e.getCode());
    }
}
