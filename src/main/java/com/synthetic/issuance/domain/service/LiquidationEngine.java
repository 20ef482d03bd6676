package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.InvariantViolationException;
import com.synthetic.issuance.domain.error.LiquidationException;
import com.synthetic.issuance.domain.error.ValidationException;
import com.synthetic.issuance.domain.model.LiquidationResult;
import com.synthetic.issuance.domain.model.SeizedCollateral;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

import static com.synthetic.issuance.domain.model.EngineParameters.LIQUIDATION_BONUS;
import static com.synthetic.issuance.domain.model.EngineParameters.LIQUIDATION_PRECISION;
import static com.synthetic.issuance.domain.model.EngineParameters.MAX_LIQUIDATION_CLOSE_FACTOR;
import static com.synthetic.issuance.domain.model.EngineParameters.MIN_HEALTH_FACTOR;

/**
 * Resolves an under-collateralized position: repays up to half of its debt with the liquidator's
 * synthetic tokens and pays the liquidator that value plus the bonus in collateral.
 * <p>
 * Runs inside the caller's unit of work. Ledger effects and both health checks happen before any
 * token moves.
 */
@Slf4j
@RequiredArgsConstructor
public class LiquidationEngine {

    private final CollateralRegistry registry;
    private final CollateralLedger ledger;
    private final HealthFactorCalculator healthFactorCalculator;
    private final CollateralSeizer seizer;
    private final CustodyGateway custody;

    public LiquidationResult liquidate(String liquidator, String user, BigInteger debtToCover, UnitOfWork uow) {
        BigInteger startingHealthFactor = healthFactorCalculator.calculate(user);
        if (startingHealthFactor.compareTo(MIN_HEALTH_FACTOR) >= 0) {
            throw new LiquidationException(ErrorCode.HEALTH_FACTOR_OK,
                    "position of " + user + " is healthy: hf=" + startingHealthFactor);
        }

        BigInteger maxCover = ledger.debt(user).multiply(MAX_LIQUIDATION_CLOSE_FACTOR).divide(LIQUIDATION_PRECISION);
        BigInteger actualCover = debtToCover.min(maxCover);
        if (actualCover.signum() == 0) {
            throw new ValidationException(ErrorCode.NEEDS_MORE_THAN_ZERO, "debt of " + user + " too small to cover");
        }
        BigInteger bonus = actualCover.multiply(LIQUIDATION_BONUS).divide(LIQUIDATION_PRECISION);
        BigInteger valueToSeize = actualCover.add(bonus);

        CollateralSeizer.Seizure seizure = seizer.seize(user, valueToSeize, uow);
        ledger.decreaseDebt(user, actualCover, uow);

        BigInteger liquidatorHealthFactor = healthFactorCalculator.calculate(liquidator);
        if (liquidatorHealthFactor.compareTo(MIN_HEALTH_FACTOR) < 0) {
            throw new InvariantViolationException(ErrorCode.BREAKS_HEALTH_FACTOR,
                    "liquidator " + liquidator + " health factor would be " + liquidatorHealthFactor);
        }
        BigInteger endingHealthFactor = healthFactorCalculator.calculate(user);

        custody.pull(custody.syntheticToken(), liquidator, actualCover, uow);
        custody.burn(actualCover, uow);
        for (SeizedCollateral part : seizure.seized()) {
            custody.payout(registry.require(part.asset()).token(), liquidator, part.amount(), uow);
        }

        if (endingHealthFactor.compareTo(startingHealthFactor) <= 0) {
            log.warn("[Liquidation] 청산 후 건전성 악화: user={}, hf {} -> {}, 추가 청산 필요",
                    user, startingHealthFactor, endingHealthFactor);
        }

        return LiquidationResult.builder()
                .user(user)
                .liquidator(liquidator)
                .debtCovered(actualCover)
                .valueToSeize(valueToSeize)
                .valueSeized(seizure.value())
                .seized(seizure.seized())
                .startingHealthFactor(startingHealthFactor)
                .endingHealthFactor(endingHealthFactor)
                .build();
    }
}
