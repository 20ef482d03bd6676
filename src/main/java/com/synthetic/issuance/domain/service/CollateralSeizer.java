package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.LiquidationException;
import com.synthetic.issuance.domain.model.CollateralAsset;
import com.synthetic.issuance.domain.model.SeizedCollateral;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static com.synthetic.issuance.domain.model.EngineParameters.SEIZURE_TOLERANCE_DENOMINATOR;
import static com.synthetic.issuance.domain.model.EngineParameters.SEIZURE_TOLERANCE_NUMERATOR;

/**
 * Takes a USD amount of collateral from a position, spread over every asset the user holds in
 * proportion to its share of the position's value.
 * <p>
 * Assets are visited in registry order. The last asset with a balance receives the remainder of
 * the target instead of its proportional share so that rounding losses on earlier assets are made
 * up there. Each share is converted at the validated oracle price and clamped to the balance.
 * <p>
 * Only the ledger is touched here; moving the tokens is left to the caller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CollateralSeizer {

    private final CollateralRegistry registry;
    private final CollateralLedger ledger;
    private final PriceOracleAdapter oracle;
    private final HealthFactorCalculator healthFactorCalculator;

    public Seizure seize(String user, BigInteger valueToSeize, UnitOfWork uow) {
        BigInteger totalCollateralValue = healthFactorCalculator.collateralValue(user);
        if (totalCollateralValue.compareTo(valueToSeize) < 0) {
            throw new LiquidationException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "collateral of " + user + " worth " + totalCollateralValue + " < seizure target " + valueToSeize);
        }

        List<CollateralAsset> held = registry.assets().stream()
                .filter(asset -> ledger.collateralBalance(user, asset.id()).signum() > 0)
                .toList();

        List<SeizedCollateral> seized = new ArrayList<>();
        BigInteger seizedValue = BigInteger.ZERO;

        for (int i = 0; i < held.size(); i++) {
            CollateralAsset asset = held.get(i);
            BigInteger balance = ledger.collateralBalance(user, asset.id());
            boolean last = i == held.size() - 1;

            BigInteger shareUsd = last
                    ? valueToSeize.subtract(seizedValue)
                    : oracle.usdValue(asset, balance).multiply(valueToSeize).divide(totalCollateralValue);
            if (shareUsd.signum() <= 0) continue;

            // price may have moved since the total was taken
            BigInteger amount = oracle.tokenAmountFromUsd(asset, shareUsd, uow.now()).min(balance);
            if (amount.signum() == 0) continue;

            ledger.debit(user, asset.id(), amount, uow);
            BigInteger transferredUsd = oracle.usdValue(asset, amount);
            seized.add(new SeizedCollateral(asset.id(), amount, transferredUsd));
            seizedValue = seizedValue.add(transferredUsd);

            log.debug("[Seizure] user={}, asset={}, shareUsd={}, amount={}, transferredUsd={}, progress={}/{}",
                    user, asset.id(), shareUsd, amount, transferredUsd, seizedValue, valueToSeize);

            if (seizedValue.compareTo(valueToSeize) >= 0) break;
        }

        if (seizedValue.multiply(SEIZURE_TOLERANCE_DENOMINATOR)
                .compareTo(valueToSeize.multiply(SEIZURE_TOLERANCE_NUMERATOR)) < 0) {
            throw new LiquidationException(ErrorCode.INSUFFICIENT_COLLATERAL,
                    "seized " + seizedValue + " of target " + valueToSeize + " from " + user);
        }
        return new Seizure(List.copyOf(seized), seizedValue);
    }

    public record Seizure(List<SeizedCollateral> seized, BigInteger value) {}
}
