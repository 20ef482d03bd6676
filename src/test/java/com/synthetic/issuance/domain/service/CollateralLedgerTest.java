package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.ValidationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class CollateralLedgerTest {

    private final CollateralLedger ledger = new CollateralLedger();
    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();

    private UnitOfWork uow() {
        return new UnitOfWork("test", Instant.EPOCH, registry.counter("failures"));
    }

    @Test
    @DisplayName("rollback restores balances and removes positions opened in the unit of work")
    void rollbackRestores() {
        UnitOfWork setup = uow();
        ledger.credit("alice", "WETH", BigInteger.TEN, setup);
        ledger.increaseDebt("alice", BigInteger.TWO, setup);
        setup.commit();

        UnitOfWork uow = uow();
        ledger.debit("alice", "WETH", BigInteger.valueOf(4), uow);
        ledger.decreaseDebt("alice", BigInteger.ONE, uow);
        ledger.credit("bob", "WBTC", BigInteger.ONE, uow);
        ledger.increaseDebt("bob", BigInteger.ONE, uow);
        uow.rollback(new RuntimeException());

        assertEquals(BigInteger.TEN, ledger.collateralBalance("alice", "WETH"));
        assertEquals(BigInteger.TWO, ledger.debt("alice"));
        assertEquals(BigInteger.ZERO, ledger.collateralBalance("bob", "WBTC"));
        assertFalse(ledger.users().contains("bob"));
        assertEquals(BigInteger.TEN, ledger.totalCollateral("WETH"));
    }

    @Test
    @DisplayName("overdrawing collateral or debt → INSUFFICIENT_BALANCE")
    void overdraw() {
        UnitOfWork uow = uow();
        ledger.credit("alice", "WETH", BigInteger.ONE, uow);

        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, assertThrows(ValidationException.class,
                () -> ledger.debit("alice", "WETH", BigInteger.TWO, uow)).getCode());
        assertEquals(ErrorCode.INSUFFICIENT_BALANCE, assertThrows(ValidationException.class,
                () -> ledger.decreaseDebt("alice", BigInteger.ONE, uow)).getCode());
        assertEquals(BigInteger.ONE, ledger.collateralBalance("alice", "WETH"));
    }
}
