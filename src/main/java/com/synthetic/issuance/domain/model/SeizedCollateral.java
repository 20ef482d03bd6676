package com.synthetic.issuance.domain.model;

import java.math.BigInteger;

public record SeizedCollateral(String asset, BigInteger amount, BigInteger usdValue) {
}
