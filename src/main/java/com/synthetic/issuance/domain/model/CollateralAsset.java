package com.synthetic.issuance.domain.model;

import com.synthetic.issuance.domain.token.FungibleToken;
import com.synthetic.issuance.domain.token.PriceFeed;

public record CollateralAsset(String id, FungibleToken token, PriceFeed priceFeed) {

    public CollateralAsset {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("asset id must not be blank");
        }
        if (token == null) {
            throw new IllegalArgumentException("token must not be null: " + id);
        }
        if (priceFeed == null) {
            throw new IllegalArgumentException("priceFeed must not be null: " + id);
        }
        id = id.toUpperCase();
    }
}
