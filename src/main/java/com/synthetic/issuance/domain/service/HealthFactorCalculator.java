package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.model.AccountInformation;
import com.synthetic.issuance.domain.model.CollateralAsset;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigInteger;

import static com.synthetic.issuance.domain.model.EngineParameters.LIQUIDATION_PRECISION;
import static com.synthetic.issuance.domain.model.EngineParameters.LIQUIDATION_THRESHOLD;
import static com.synthetic.issuance.domain.model.EngineParameters.MAX_HEALTH_FACTOR;
import static com.synthetic.issuance.domain.model.EngineParameters.MIN_HEALTH_FACTOR;
import static com.synthetic.issuance.domain.model.EngineParameters.PRECISION;

@Component
@RequiredArgsConstructor
public class HealthFactorCalculator {

    private final CollateralRegistry registry;
    private final CollateralLedger ledger;
    private final PriceOracleAdapter oracle;

    /** Recomputed from current prices on every call. */
    public BigInteger calculate(String user) {
        AccountInformation info = accountInformation(user);
        return calculate(info.debt(), info.collateralValueUsd());
    }

    public BigInteger calculate(BigInteger debt, BigInteger collateralValueUsd) {
        if (debt.signum() == 0) {
            return MAX_HEALTH_FACTOR;
        }
        BigInteger adjusted = collateralValueUsd.multiply(LIQUIDATION_THRESHOLD).divide(LIQUIDATION_PRECISION);
        return adjusted.multiply(PRECISION).divide(debt);
    }

    public boolean isHealthy(String user) {
        return calculate(user).compareTo(MIN_HEALTH_FACTOR) >= 0;
    }

    public AccountInformation accountInformation(String user) {
        return new AccountInformation(ledger.debt(user), collateralValue(user));
    }

    // every registered asset is priced, zero balances included
    public BigInteger collateralValue(String user) {
        BigInteger total = BigInteger.ZERO;
        for (CollateralAsset asset : registry.assets()) {
            BigInteger balance = ledger.collateralBalance(user, asset.id());
            total = total.add(oracle.usdValue(asset, balance));
        }
        return total;
    }
}
