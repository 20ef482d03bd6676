package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;

import static com.synthetic.issuance.domain.model.EngineParameters.MAX_HEALTH_FACTOR;
import static com.synthetic.issuance.support.EngineFixture.ether;
import static org.junit.jupiter.api.Assertions.*;

class HealthFactorCalculatorTest {

    private final EngineFixture f = new EngineFixture();
    private final HealthFactorCalculator calculator = f.healthFactorCalculator;

    @Test
    @DisplayName("zero debt → maximum health factor regardless of collateral")
    void zeroDebt() {
        assertEquals(MAX_HEALTH_FACTOR, calculator.calculate(BigInteger.ZERO, BigInteger.ZERO));
        assertEquals(MAX_HEALTH_FACTOR, calculator.calculate(BigInteger.ZERO, ether(1_000)));
        assertEquals(MAX_HEALTH_FACTOR, calculator.calculate("nobody"));
    }

    @Test
    @DisplayName("collateral is counted at 50% of its value")
    void thresholdApplied() {
        assertEquals(ether(1), calculator.calculate(ether(100), ether(200)));
        assertEquals(ether(2), calculator.calculate(ether(5_000), ether(20_000)));
        assertEquals(ether(1, 2), calculator.calculate(ether(100), ether(100)));
    }

    @Test
    @DisplayName("result truncates toward zero")
    void truncates() {
        // 50 * 1e18 / 3e18 = 16.666...
        assertEquals(new BigInteger("16666666666666666666"), calculator.calculate(ether(3), ether(100)));
    }

    @Test
    @DisplayName("no collateral with debt → zero")
    void noCollateral() {
        assertEquals(BigInteger.ZERO, calculator.calculate(ether(1), BigInteger.ZERO));
    }

    @Test
    @DisplayName("collateral value sums every registered asset at the current price")
    void collateralValueAcrossAssets() {
        UnitOfWork uow = new UnitOfWork("test", EngineFixture.NOW, f.meterRegistry.counter("test.failures"));
        f.ledger.credit("alice", "WETH", ether(2), uow);
        f.ledger.credit("alice", "WBTC", ether(1, 10), uow);
        uow.commit();

        // 2 * 2000 + 0.1 * 30000
        assertEquals(ether(7_000), calculator.collateralValue("alice"));
        f.wbtcFeed.setPrice(20_000, EngineFixture.NOW);
        assertEquals(ether(6_000), calculator.collateralValue("alice"));
        assertTrue(calculator.isHealthy("alice"));
    }
}
