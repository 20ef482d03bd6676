package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.ValidationException;
import com.synthetic.issuance.domain.model.CollateralAsset;
import com.synthetic.issuance.domain.token.FungibleToken;
import com.synthetic.issuance.domain.token.PriceFeed;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Collateral assets accepted by the engine, fixed at construction. Iteration order is the
 * configuration order and drives liquidation seizure.
 */
public final class CollateralRegistry {

    private final List<CollateralAsset> assets;
    private final Map<String, CollateralAsset> byId;

    private CollateralRegistry(List<CollateralAsset> assets) {
        Map<String, CollateralAsset> index = new LinkedHashMap<>();
        for (CollateralAsset asset : assets) {
            if (index.putIfAbsent(asset.id(), asset) != null) {
                throw new ValidationException(ErrorCode.DUPLICATE_ASSET, "duplicate collateral asset: " + asset.id());
            }
        }
        this.assets = List.copyOf(assets);
        this.byId = Collections.unmodifiableMap(index);
    }

    public static CollateralRegistry of(List<CollateralAsset> assets) {
        return new CollateralRegistry(assets);
    }

    /**
     * Pairs the three lists by position. All of them must have the same length.
     */
    public static CollateralRegistry of(List<String> ids, List<? extends FungibleToken> tokens,
                                        List<? extends PriceFeed> feeds) {
        if (ids.size() != tokens.size() || ids.size() != feeds.size()) {
            throw new ValidationException(ErrorCode.CONFIGURATION_LENGTH_MISMATCH,
                    "assets=" + ids.size() + ", tokens=" + tokens.size() + ", feeds=" + feeds.size());
        }
        List<CollateralAsset> assets = new ArrayList<>(ids.size());
        for (int i = 0; i < ids.size(); i++) {
            assets.add(new CollateralAsset(ids.get(i), tokens.get(i), feeds.get(i)));
        }
        return new CollateralRegistry(assets);
    }

    public CollateralAsset require(String assetId) {
        CollateralAsset asset = assetId == null ? null : byId.get(assetId.toUpperCase());
        if (asset == null) {
            throw new ValidationException(ErrorCode.TOKEN_NOT_ALLOWED, "collateral not allowed: " + assetId);
        }
        return asset;
    }

    public boolean contains(String assetId) {
        return assetId != null && byId.containsKey(assetId.toUpperCase());
    }

    public List<CollateralAsset> assets() {
        return assets;
    }

    public List<String> ids() {
        return assets.stream().map(CollateralAsset::id).toList();
    }

    public int size() {
        return assets.size();
    }
}
