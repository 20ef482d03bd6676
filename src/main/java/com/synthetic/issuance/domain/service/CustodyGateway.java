package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.TransferException;
import com.synthetic.issuance.domain.token.FungibleToken;
import com.synthetic.issuance.domain.token.SyntheticToken;
import lombok.extern.slf4j.Slf4j;

import java.math.BigInteger;

/**
 * Calls into token collaborators on behalf of the engine's custody account. A refused call becomes
 * a {@link TransferException}; a completed call registers the call that reverses it. Tokens paid
 * or minted out of custody are taken back with {@link FungibleToken#reclaim}, so a reversal never
 * depends on an allowance from the recipient.
 */
@Slf4j
public class CustodyGateway {

    private final String custodyAccount;
    private final SyntheticToken syntheticToken;

    public CustodyGateway(String custodyAccount, SyntheticToken syntheticToken) {
        if (custodyAccount == null || custodyAccount.isBlank()) {
            throw new IllegalArgumentException("custodyAccount must not be blank");
        }
        this.custodyAccount = custodyAccount;
        this.syntheticToken = syntheticToken;
    }

    public String custodyAccount() {
        return custodyAccount;
    }

    public SyntheticToken syntheticToken() {
        return syntheticToken;
    }

    public void pull(FungibleToken token, String payer, BigInteger amount, UnitOfWork uow) {
        if (!token.transferFrom(payer, custodyAccount, amount)) {
            throw new TransferException(ErrorCode.TRANSFER_FAILED, token.symbol(),
                    token.symbol() + " transferFrom " + payer + " -> custody refused, amount=" + amount);
        }
        uow.onRollback("return " + token.symbol() + " to " + payer,
                () -> requireTransfer(token.transfer(custodyAccount, payer, amount), token, payer, amount));
    }

    public void payout(FungibleToken token, String recipient, BigInteger amount, UnitOfWork uow) {
        if (!token.transfer(custodyAccount, recipient, amount)) {
            throw new TransferException(ErrorCode.TRANSFER_FAILED, token.symbol(),
                    token.symbol() + " transfer custody -> " + recipient + " refused, amount=" + amount);
        }
        uow.onRollback("reclaim " + token.symbol() + " from " + recipient,
                () -> requireTransfer(token.reclaim(recipient, custodyAccount, amount), token, recipient, amount));
    }

    public void mint(String to, BigInteger amount, UnitOfWork uow) {
        if (!syntheticToken.mint(to, amount)) {
            throw new TransferException(ErrorCode.MINT_FAILED, syntheticToken.symbol(),
                    syntheticToken.symbol() + " mint refused: to=" + to + ", amount=" + amount);
        }
        uow.onRollback("unmint " + syntheticToken.symbol() + " from " + to, () -> {
            requireTransfer(syntheticToken.reclaim(to, custodyAccount, amount), syntheticToken, to, amount);
            syntheticToken.burn(custodyAccount, amount);
        });
    }

    /** Burns tokens already pulled into custody. */
    public void burn(BigInteger amount, UnitOfWork uow) {
        try {
            syntheticToken.burn(custodyAccount, amount);
        } catch (IllegalStateException e) {
            throw new TransferException(ErrorCode.BURN_FAILED, syntheticToken.symbol(),
                    syntheticToken.symbol() + " burn refused: amount=" + amount, e);
        }
        uow.onRollback("reissue burned " + syntheticToken.symbol(),
                () -> requireMint(syntheticToken.mint(custodyAccount, amount), amount));
    }

    private static void requireTransfer(boolean ok, FungibleToken token, String counterparty, BigInteger amount) {
        if (!ok) {
            throw new IllegalStateException(token.symbol() + " compensation refused: counterparty="
                    + counterparty + ", amount=" + amount);
        }
    }

    private void requireMint(boolean ok, BigInteger amount) {
        if (!ok) {
            throw new IllegalStateException(syntheticToken.symbol() + " re-mint refused: amount=" + amount);
        }
    }
}
