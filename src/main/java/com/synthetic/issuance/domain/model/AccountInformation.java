package com.synthetic.issuance.domain.model;

import java.math.BigInteger;

public record AccountInformation(BigInteger debt, BigInteger collateralValueUsd) {
}
