package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.OracleException;
import com.synthetic.issuance.domain.model.CollateralAsset;
import com.synthetic.issuance.domain.model.PriceQuote;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.time.Instant;

import static com.synthetic.issuance.domain.model.EngineParameters.ADDITIONAL_FEED_PRECISION;
import static com.synthetic.issuance.domain.model.EngineParameters.PRECISION;
import static com.synthetic.issuance.domain.model.EngineParameters.STALENESS_TIMEOUT;

/**
 * Converts between collateral amounts and USD value (both 18-decimal fixed point) using 8-decimal
 * feed prices.
 * <p>
 * {@link #usdValue} takes the latest answer as is. {@link #tokenAmountFromUsd} sizes seizures and
 * rejects non-positive or stale answers.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PriceOracleAdapter {

    private final CollateralRegistry registry;
    private final MeterRegistry meterRegistry;

    public BigInteger usdValue(String assetId, BigInteger amount) {
        return usdValue(registry.require(assetId), amount);
    }

    public BigInteger usdValue(CollateralAsset asset, BigInteger amount) {
        PriceQuote quote = asset.priceFeed().latestQuote();
        return quote.price()
                .multiply(ADDITIONAL_FEED_PRECISION)
                .multiply(amount)
                .divide(PRECISION);
    }

    public BigInteger tokenAmountFromUsd(String assetId, BigInteger usdAmount, Instant now) {
        return tokenAmountFromUsd(registry.require(assetId), usdAmount, now);
    }

    public BigInteger tokenAmountFromUsd(CollateralAsset asset, BigInteger usdAmount, Instant now) {
        PriceQuote quote = validatedQuote(asset, now);
        return usdAmount
                .multiply(PRECISION)
                .divide(quote.price().multiply(ADDITIONAL_FEED_PRECISION));
    }

    PriceQuote validatedQuote(CollateralAsset asset, Instant now) {
        PriceQuote quote = asset.priceFeed().latestQuote();
        if (!quote.isPositive()) {
            reject("invalid_price");
            log.warn("[Oracle] 비정상 가격: asset={}, price={}", asset.id(), quote.price());
            throw new OracleException(ErrorCode.INVALID_PRICE, asset.id(),
                    "non-positive price for " + asset.id() + ": " + quote.price());
        }
        if (quote.age(now).compareTo(STALENESS_TIMEOUT) > 0) {
            reject("stale_price");
            log.warn("[Oracle] 오래된 가격: asset={}, updatedAt={}, age={}s",
                    asset.id(), quote.updatedAt(), quote.age(now).toSeconds());
            throw new OracleException(ErrorCode.STALE_PRICE, asset.id(),
                    "stale price for " + asset.id() + ", updatedAt=" + quote.updatedAt());
        }
        return quote;
    }

    private void reject(String reason) {
        meterRegistry.counter("oracle.rejections", "reason", reason).increment();
    }
}
