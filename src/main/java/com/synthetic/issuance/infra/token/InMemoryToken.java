package com.synthetic.issuance.infra.token;

import com.synthetic.issuance.domain.token.SyntheticToken;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local fungible token with allowances. Used for the synthetic token and for collateral
 * tokens when the engine runs without an external token network.
 * <p>
 * Refused transfers return {@code false}. Burning only draws on the minter's own balance.
 */
@Slf4j
public class InMemoryToken implements SyntheticToken {

    private final String symbol;
    private final String minter;

    private final Map<String, BigInteger> balances = new ConcurrentHashMap<>();
    private final Map<String, Map<String, BigInteger>> allowances = new ConcurrentHashMap<>();
    private BigInteger totalSupply = BigInteger.ZERO;

    public InMemoryToken(String symbol, String minter) {
        this.symbol = symbol;
        this.minter = minter;
    }

    @Override
    public String symbol() {
        return symbol;
    }

    public String minter() {
        return minter;
    }

    @Override
    public synchronized boolean transferFrom(String payer, String recipient, BigInteger amount) {
        BigInteger allowed = allowance(payer, recipient);
        if (allowed.compareTo(amount) < 0) {
            log.debug("[Token] {} allowance 부족: owner={}, spender={}, allowed={}, amount={}",
                    symbol, payer, recipient, allowed, amount);
            return false;
        }
        if (!move(payer, recipient, amount)) return false;
        allowances.get(payer).put(recipient, allowed.subtract(amount));
        return true;
    }

    @Override
    public synchronized boolean transfer(String sender, String recipient, BigInteger amount) {
        return move(sender, recipient, amount);
    }

    @Override
    public synchronized boolean reclaim(String holder, String custodian, BigInteger amount) {
        if (!minter.equals(custodian)) {
            log.warn("[Token] {} reclaim 거부: custodian={} 은(는) 관리 계정이 아님", symbol, custodian);
            return false;
        }
        return move(holder, custodian, amount);
    }

    public synchronized void approve(String owner, String spender, BigInteger amount) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException("allowance must not be negative");
        }
        allowances.computeIfAbsent(owner, k -> new ConcurrentHashMap<>()).put(spender, amount);
    }

    public BigInteger allowance(String owner, String spender) {
        Map<String, BigInteger> granted = allowances.get(owner);
        if (granted == null) return BigInteger.ZERO;
        return granted.getOrDefault(spender, BigInteger.ZERO);
    }

    @Override
    public BigInteger balanceOf(String account) {
        return balances.getOrDefault(account, BigInteger.ZERO);
    }

    @Override
    public synchronized BigInteger totalSupply() {
        return totalSupply;
    }

    @Override
    public synchronized boolean mint(String to, BigInteger amount) {
        if (to == null || to.isBlank() || amount.signum() <= 0) {
            return false;
        }
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        return true;
    }

    @Override
    public synchronized void burn(String holder, BigInteger amount) {
        if (!minter.equals(holder)) {
            throw new IllegalStateException(symbol + " burn restricted to minter, holder=" + holder);
        }
        if (amount.signum() <= 0) {
            throw new IllegalStateException(symbol + " burn amount must be more than zero");
        }
        BigInteger balance = balanceOf(holder);
        if (balance.compareTo(amount) < 0) {
            throw new IllegalStateException(symbol + " burn amount exceeds balance: " + balance + " < " + amount);
        }
        balances.put(holder, balance.subtract(amount));
        totalSupply = totalSupply.subtract(amount);
    }

    /** Unrestricted mint for development faucets and test fixtures. */
    public synchronized void faucet(String to, BigInteger amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("faucet amount must be more than zero");
        }
        balances.merge(to, amount, BigInteger::add);
        totalSupply = totalSupply.add(amount);
        log.info("[Token] faucet: symbol={}, to={}, amount={}", symbol, to, amount);
    }

    private boolean move(String from, String to, BigInteger amount) {
        if (to == null || to.isBlank() || amount.signum() < 0) return false;
        BigInteger balance = balanceOf(from);
        if (balance.compareTo(amount) < 0) return false;
        balances.put(from, balance.subtract(amount));
        balances.merge(to, amount, BigInteger::add);
        return true;
    }
}
