package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-user collateral balances and debt. Every mutation takes the caller's {@link UnitOfWork} and
 * registers its own reversal there.
 */
@Slf4j
@Component
public class CollateralLedger {

    private final Map<String, Map<String, BigInteger>> collateral = new ConcurrentHashMap<>();
    private final Map<String, BigInteger> debt = new ConcurrentHashMap<>();

    public void credit(String user, String assetId, BigInteger amount, UnitOfWork uow) {
        Map<String, BigInteger> balances = balancesFor(user, uow);
        BigInteger previous = balances.get(assetId);
        balances.put(assetId, orZero(previous).add(amount));
        uow.onRollback("credit " + user + "/" + assetId, () -> restore(balances, assetId, previous));
        log.debug("[Ledger] credit: user={}, asset={}, amount={}", user, assetId, amount);
    }

    public void debit(String user, String assetId, BigInteger amount, UnitOfWork uow) {
        BigInteger current = collateralBalance(user, assetId);
        if (current.compareTo(amount) < 0) {
            throw new ValidationException(ErrorCode.INSUFFICIENT_BALANCE,
                    "collateral " + assetId + " of " + user + " is " + current + ", requested " + amount);
        }
        Map<String, BigInteger> balances = collateral.get(user);
        balances.put(assetId, current.subtract(amount));
        uow.onRollback("debit " + user + "/" + assetId, () -> balances.put(assetId, current));
        log.debug("[Ledger] debit: user={}, asset={}, amount={}", user, assetId, amount);
    }

    public void increaseDebt(String user, BigInteger amount, UnitOfWork uow) {
        BigInteger previous = debt.get(user);
        debt.put(user, orZero(previous).add(amount));
        uow.onRollback("increaseDebt " + user, () -> restore(debt, user, previous));
    }

    public void decreaseDebt(String user, BigInteger amount, UnitOfWork uow) {
        BigInteger current = debt(user);
        if (current.compareTo(amount) < 0) {
            throw new ValidationException(ErrorCode.INSUFFICIENT_BALANCE,
                    "debt of " + user + " is " + current + ", requested burn " + amount);
        }
        debt.put(user, current.subtract(amount));
        uow.onRollback("decreaseDebt " + user, () -> debt.put(user, current));
    }

    public BigInteger collateralBalance(String user, String assetId) {
        Map<String, BigInteger> balances = collateral.get(user);
        if (balances == null) return BigInteger.ZERO;
        return orZero(balances.get(assetId));
    }

    public BigInteger debt(String user) {
        return orZero(debt.get(user));
    }

    public BigInteger totalCollateral(String assetId) {
        return collateral.values().stream()
                .map(balances -> orZero(balances.get(assetId)))
                .reduce(BigInteger.ZERO, BigInteger::add);
    }

    /** Users that ever held collateral or debt, zero positions included. */
    public Set<String> users() {
        Set<String> users = ConcurrentHashMap.newKeySet();
        users.addAll(collateral.keySet());
        users.addAll(debt.keySet());
        return Collections.unmodifiableSet(users);
    }

    private Map<String, BigInteger> balancesFor(String user, UnitOfWork uow) {
        Map<String, BigInteger> balances = collateral.get(user);
        if (balances == null) {
            Map<String, BigInteger> created = new ConcurrentHashMap<>();
            collateral.put(user, created);
            uow.onRollback("open position " + user, () -> collateral.remove(user, created));
            return created;
        }
        return balances;
    }

    private static <K> void restore(Map<K, BigInteger> map, K key, BigInteger previous) {
        if (previous == null) {
            map.remove(key);
        } else {
            map.put(key, previous);
        }
    }

    private static BigInteger orZero(BigInteger value) {
        return value == null ? BigInteger.ZERO : value;
    }
}
