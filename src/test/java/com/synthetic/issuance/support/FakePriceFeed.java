package com.synthetic.issuance.support;

import com.synthetic.issuance.domain.model.PriceQuote;
import com.synthetic.issuance.domain.token.PriceFeed;

import java.math.BigInteger;
import java.time.Instant;

public class FakePriceFeed implements PriceFeed {

    private final String description;
    private PriceQuote quote;

    public FakePriceFeed(String description, long usdPrice, Instant updatedAt) {
        this.description = description;
        setPrice(usdPrice, updatedAt);
    }

    public void setPrice(long usdPrice, Instant updatedAt) {
        this.quote = new PriceQuote(BigInteger.valueOf(usdPrice).multiply(BigInteger.TEN.pow(8)), updatedAt);
    }

    public void setQuote(PriceQuote quote) {
        this.quote = quote;
    }

    @Override
    public PriceQuote latestQuote() {
        return quote;
    }

    @Override
    public String description() {
        return description;
    }
}
