package com.synthetic.issuance.domain.token;

import java.math.BigInteger;

/**
 * Transfer capability of a fungible token held outside the engine. Implementations signal a
 * refused transfer by returning {@code false}; they may also call back into the engine before
 * returning.
 */
public interface FungibleToken {

    String symbol();

    /**
     * Moves {@code amount} from {@code payer} to {@code recipient}, spending the allowance
     * {@code payer} granted to {@code recipient}.
     */
    boolean transferFrom(String payer, String recipient, BigInteger amount);

    boolean transfer(String sender, String recipient, BigInteger amount);

    /**
     * Takes back {@code amount} that {@code custodian} paid or minted to {@code holder} earlier in
     * the same engine operation. No allowance is consulted; only the token's custodian may reclaim.
     */
    boolean reclaim(String holder, String custodian, BigInteger amount);

    BigInteger balanceOf(String account);

    BigInteger totalSupply();
}
