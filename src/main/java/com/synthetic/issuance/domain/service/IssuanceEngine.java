package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.InvariantViolationException;
import com.synthetic.issuance.domain.error.IssuanceException;
import com.synthetic.issuance.domain.error.ValidationException;
import com.synthetic.issuance.domain.model.AccountInformation;
import com.synthetic.issuance.domain.model.CollateralAsset;
import com.synthetic.issuance.domain.model.LedgerEvent;
import com.synthetic.issuance.domain.model.LedgerEventType;
import com.synthetic.issuance.domain.model.LiquidationResult;
import com.synthetic.issuance.domain.token.PriceFeed;
import com.synthetic.issuance.domain.token.SyntheticToken;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

import static com.synthetic.issuance.domain.model.EngineParameters.MIN_HEALTH_FACTOR;

/**
 * Entry points of the issuance engine.
 * <p>
 * Every mutating call runs under the {@link ReentrancyGuard} in its own {@link UnitOfWork}: it
 * either commits all its ledger changes and token movements or none of them. Ledger events are
 * published only after commit.
 */
@Slf4j
public class IssuanceEngine {

    private final CollateralRegistry registry;
    private final CollateralLedger ledger;
    private final PriceOracleAdapter oracle;
    private final HealthFactorCalculator healthFactorCalculator;
    private final LiquidationEngine liquidationEngine;
    private final CustodyGateway custody;
    private final ReentrancyGuard guard;
    private final LedgerEventSink eventSink;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Counter compensationFailures;
    private final Counter liquidations;
    private final Timer liquidationTimer;

    public IssuanceEngine(CollateralRegistry registry,
                          CollateralLedger ledger,
                          PriceOracleAdapter oracle,
                          HealthFactorCalculator healthFactorCalculator,
                          LiquidationEngine liquidationEngine,
                          CustodyGateway custody,
                          ReentrancyGuard guard,
                          LedgerEventSink eventSink,
                          Clock clock,
                          MeterRegistry meterRegistry) {
        this.registry = registry;
        this.ledger = ledger;
        this.oracle = oracle;
        this.healthFactorCalculator = healthFactorCalculator;
        this.liquidationEngine = liquidationEngine;
        this.custody = custody;
        this.guard = guard;
        this.eventSink = eventSink;
        this.clock = clock;
        this.meterRegistry = meterRegistry;

        this.compensationFailures = Counter.builder("issuance.compensation.failures")
                .description("Collaborator calls that could not be reversed during rollback")
                .register(meterRegistry);
        this.liquidations = Counter.builder("issuance.liquidations")
                .description("Committed liquidations")
                .register(meterRegistry);
        this.liquidationTimer = Timer.builder("issuance.liquidation.duration")
                .description("Liquidation wall time including seizure")
                .register(meterRegistry);
    }

    // ---- mutating entry points ----

    public void depositCollateral(String user, String asset, BigInteger amount) {
        execute("depositCollateral", uow -> {
            deposit(user, asset, amount, uow);
            return null;
        });
    }

    public void depositCollateralAndMintDebt(String user, String asset, BigInteger collateralAmount,
                                             BigInteger mintAmount) {
        execute("depositCollateralAndMintDebt", uow -> {
            deposit(user, asset, collateralAmount, uow);
            mint(user, mintAmount, uow);
            return null;
        });
    }

    public void redeemCollateral(String user, String asset, BigInteger amount) {
        execute("redeemCollateral", uow -> {
            requireAccount(user);
            CollateralAsset collateral = validatedAsset(asset, amount);
            ledger.debit(user, collateral.id(), amount, uow);
            requireHealthy(user);
            custody.payout(collateral.token(), user, amount, uow);
            emit(uow, LedgerEventType.COLLATERAL_REDEEMED, user, user, collateral.id(), amount);
            log.info("[Engine] 담보 인출: user={}, asset={}, amount={}", user, collateral.id(), amount);
            return null;
        });
    }

    public void redeemCollateralForDebt(String user, String asset, BigInteger collateralAmount,
                                        BigInteger burnAmount) {
        execute("redeemCollateralForDebt", uow -> {
            requireAccount(user);
            requirePositive(burnAmount);
            CollateralAsset collateral = validatedAsset(asset, collateralAmount);
            ledger.decreaseDebt(user, burnAmount, uow);
            ledger.debit(user, collateral.id(), collateralAmount, uow);
            requireHealthy(user);

            custody.pull(custody.syntheticToken(), user, burnAmount, uow);
            custody.burn(burnAmount, uow);
            custody.payout(collateral.token(), user, collateralAmount, uow);

            emit(uow, LedgerEventType.DEBT_BURNED, user, user, null, burnAmount);
            emit(uow, LedgerEventType.COLLATERAL_REDEEMED, user, user, collateral.id(), collateralAmount);
            log.info("[Engine] 부채 상환 후 담보 인출: user={}, asset={}, collateral={}, burned={}",
                    user, collateral.id(), collateralAmount, burnAmount);
            return null;
        });
    }

    public void mintDebt(String user, BigInteger amount) {
        execute("mintDebt", uow -> {
            mint(user, amount, uow);
            return null;
        });
    }

    public void burnDebt(String user, BigInteger amount) {
        execute("burnDebt", uow -> {
            requireAccount(user);
            requirePositive(amount);
            ledger.decreaseDebt(user, amount, uow);
            // burning only lowers debt; checked anyway
            requireHealthy(user);
            custody.pull(custody.syntheticToken(), user, amount, uow);
            custody.burn(amount, uow);
            emit(uow, LedgerEventType.DEBT_BURNED, user, user, null, amount);
            log.info("[Engine] 부채 소각: user={}, amount={}", user, amount);
            return null;
        });
    }

    public LiquidationResult liquidate(String liquidator, String user, BigInteger debtToCover) {
        Timer.Sample sample = Timer.start(meterRegistry);
        LiquidationResult result = execute("liquidate", uow -> {
            requireAccount(liquidator);
            requireAccount(user);
            requirePositive(debtToCover);
            LiquidationResult r = liquidationEngine.liquidate(liquidator, user, debtToCover, uow);
            emit(uow, LedgerEventType.DEBT_BURNED, user, liquidator, null, r.getDebtCovered());
            r.getSeized().forEach(part ->
                    emit(uow, LedgerEventType.COLLATERAL_REDEEMED, user, liquidator, part.asset(), part.amount()));
            emit(uow, LedgerEventType.POSITION_LIQUIDATED, user, liquidator, null, r.getDebtCovered());
            return r;
        });
        sample.stop(liquidationTimer);
        liquidations.increment();

        log.info("[Liquidation] 청산 완료: user={}, liquidator={}, covered={}, target={}, seized={}, hf {} -> {}, assets={}",
                user, liquidator, result.getDebtCovered(), result.getValueToSeize(), result.getValueSeized(),
                result.getStartingHealthFactor(), result.getEndingHealthFactor(), result.getSeized().size());
        return result;
    }

    // ---- read operations ----

    public BigInteger usdValue(String asset, BigInteger amount) {
        return guard.read(() -> oracle.usdValue(asset, amount));
    }

    public BigInteger tokenAmountFromUsd(String asset, BigInteger usdAmount) {
        return guard.read(() -> oracle.tokenAmountFromUsd(asset, usdAmount, clock.instant()));
    }

    public AccountInformation accountInformation(String user) {
        return guard.read(() -> healthFactorCalculator.accountInformation(user));
    }

    public BigInteger accountCollateralValue(String user) {
        return guard.read(() -> healthFactorCalculator.collateralValue(user));
    }

    public BigInteger collateralBalance(String user, String asset) {
        String id = registry.require(asset).id();
        return guard.read(() -> ledger.collateralBalance(user, id));
    }

    public BigInteger healthFactor(String user) {
        return guard.read(() -> healthFactorCalculator.calculate(user));
    }

    public BigInteger calculateHealthFactor(BigInteger debt, BigInteger collateralValueUsd) {
        return healthFactorCalculator.calculate(debt, collateralValueUsd);
    }

    public List<String> collateralTokens() {
        return registry.ids();
    }

    public PriceFeed priceFeed(String asset) {
        return registry.require(asset).priceFeed();
    }

    public SyntheticToken syntheticToken() {
        return custody.syntheticToken();
    }

    public String custodyAccount() {
        return custody.custodyAccount();
    }

    /** Positions with debt whose health factor is below the minimum, worst first. */
    public List<PositionHealth> liquidatablePositions() {
        return guard.read(() -> {
            List<PositionHealth> result = new ArrayList<>();
            for (String user : ledger.users()) {
                AccountInformation info = healthFactorCalculator.accountInformation(user);
                if (info.debt().signum() == 0) continue;
                BigInteger hf = healthFactorCalculator.calculate(info.debt(), info.collateralValueUsd());
                if (hf.compareTo(MIN_HEALTH_FACTOR) < 0) {
                    result.add(new PositionHealth(user, info.debt(), info.collateralValueUsd(), hf));
                }
            }
            result.sort(Comparator.comparing(PositionHealth::healthFactor));
            return result;
        });
    }

    // ---- internals ----

    private <T> T execute(String operation, Function<UnitOfWork, T> body) {
        try {
            T result = guard.guarded(operation, () -> {
                UnitOfWork uow = new UnitOfWork(operation, clock.instant(), compensationFailures);
                try {
                    T value = body.apply(uow);
                    uow.commit();
                    return value;
                } catch (RuntimeException e) {
                    uow.rollback(e);
                    throw e;
                }
            });
            record(operation, "success");
            return result;
        } catch (IssuanceException e) {
            record(operation, e.getCode().name().toLowerCase(Locale.ROOT));
            log.warn("[Engine] 작업 거부: op={}, code={}, reason={}", operation, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            record(operation, "error");
            log.error("[Engine] 작업 실패: op={}", operation, e);
            throw e;
        }
    }

    private void deposit(String user, String asset, BigInteger amount, UnitOfWork uow) {
        requireAccount(user);
        CollateralAsset collateral = validatedAsset(asset, amount);
        ledger.credit(user, collateral.id(), amount, uow);
        custody.pull(collateral.token(), user, amount, uow);
        emit(uow, LedgerEventType.COLLATERAL_DEPOSITED, user, null, collateral.id(), amount);
        log.info("[Engine] 담보 예치: user={}, asset={}, amount={}", user, collateral.id(), amount);
    }

    private void mint(String user, BigInteger amount, UnitOfWork uow) {
        requireAccount(user);
        requirePositive(amount);
        ledger.increaseDebt(user, amount, uow);
        requireHealthy(user);
        custody.mint(user, amount, uow);
        emit(uow, LedgerEventType.DEBT_MINTED, user, null, null, amount);
        log.info("[Engine] 부채 발행: user={}, amount={}", user, amount);
    }

    private CollateralAsset validatedAsset(String asset, BigInteger amount) {
        requirePositive(amount);
        return registry.require(asset);
    }

    private void requireHealthy(String user) {
        BigInteger hf = healthFactorCalculator.calculate(user);
        if (hf.compareTo(MIN_HEALTH_FACTOR) < 0) {
            throw new InvariantViolationException(ErrorCode.BREAKS_HEALTH_FACTOR,
                    "health factor of " + user + " would be " + hf);
        }
    }

    private void requireAccount(String account) {
        if (account == null || account.isBlank() || account.equals(custody.custodyAccount())) {
            throw new ValidationException(ErrorCode.INVALID_ACCOUNT, "invalid account: " + account);
        }
    }

    private static void requirePositive(BigInteger amount) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException(ErrorCode.NEEDS_MORE_THAN_ZERO, "amount must be more than zero: " + amount);
        }
    }

    private void emit(UnitOfWork uow, LedgerEventType type, String user, String counterparty,
                      String asset, BigInteger amount) {
        LedgerEvent event = LedgerEvent.builder()
                .type(type)
                .user(user)
                .counterparty(counterparty)
                .asset(asset)
                .amount(amount)
                .timestamp(uow.now().toEpochMilli())
                .build();
        uow.afterCommit(() -> eventSink.publish(event));
    }

    private void record(String operation, String outcome) {
        meterRegistry.counter("issuance.operations", "operation", operation, "outcome", outcome).increment();
    }

    public record PositionHealth(String user, BigInteger debt, BigInteger collateralValueUsd,
                                 BigInteger healthFactor) {}
}
