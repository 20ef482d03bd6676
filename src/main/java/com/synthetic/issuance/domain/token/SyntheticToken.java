package com.synthetic.issuance.domain.token;

import java.math.BigInteger;

/**
 * The USD-pegged debt token. Only the engine's custody account may mint or burn.
 */
public interface SyntheticToken extends FungibleToken {

    boolean mint(String to, BigInteger amount);

    /**
     * Destroys {@code amount} out of {@code holder}'s balance.
     *
     * @throws IllegalStateException if the burn is refused
     */
    void burn(String holder, BigInteger amount);
}
