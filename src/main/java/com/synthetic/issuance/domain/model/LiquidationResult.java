package com.synthetic.issuance.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;
import java.util.List;

@Getter
@Builder
@ToString
public class LiquidationResult {

    private final String user;
    private final String liquidator;
    private final BigInteger debtCovered;
    private final BigInteger valueToSeize;
    private final BigInteger valueSeized;
    private final List<SeizedCollateral> seized;
    private final BigInteger startingHealthFactor;
    private final BigInteger endingHealthFactor;

    public boolean improvedHealthFactor() {
        return endingHealthFactor.compareTo(startingHealthFactor) > 0;
    }
}
