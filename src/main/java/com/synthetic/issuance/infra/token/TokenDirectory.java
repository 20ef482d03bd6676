package com.synthetic.issuance.infra.token;

import java.util.List;
import java.util.Optional;

/**
 * The in-process tokens created for this deployment, in collateral registry order.
 */
public record TokenDirectory(InMemoryToken synthetic, List<InMemoryToken> collateralTokens) {

    public static final String SYNTHETIC_ALIAS = "SYNTHETIC";

    public TokenDirectory {
        collateralTokens = List.copyOf(collateralTokens);
    }

    public Optional<InMemoryToken> find(String symbol) {
        if (symbol == null) return Optional.empty();
        String key = symbol.toUpperCase();
        if (SYNTHETIC_ALIAS.equals(key) || synthetic.symbol().equalsIgnoreCase(key)) {
            return Optional.of(synthetic);
        }
        return collateralTokens.stream()
                .filter(token -> token.symbol().equals(key))
                .findFirst();
    }
}
