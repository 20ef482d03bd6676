package com.synthetic.issuance.domain.model;

import java.math.BigInteger;
import java.time.Duration;

public final class EngineParameters {

    public static final BigInteger PRECISION = BigInteger.TEN.pow(18);
    public static final BigInteger ADDITIONAL_FEED_PRECISION = BigInteger.TEN.pow(10);

    public static final BigInteger LIQUIDATION_THRESHOLD = BigInteger.valueOf(50);
    public static final BigInteger LIQUIDATION_BONUS = BigInteger.valueOf(10);
    public static final BigInteger LIQUIDATION_PRECISION = BigInteger.valueOf(100);
    public static final BigInteger MAX_LIQUIDATION_CLOSE_FACTOR = BigInteger.valueOf(50);

    public static final BigInteger MIN_HEALTH_FACTOR = PRECISION;

    /** uint256 max, reported as the health factor of a debt-free position. */
    public static final BigInteger MAX_HEALTH_FACTOR = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);

    public static final Duration STALENESS_TIMEOUT = Duration.ofHours(3);

    // seized value must reach 99.99% of the target
    public static final BigInteger SEIZURE_TOLERANCE_NUMERATOR = BigInteger.valueOf(9_999);
    public static final BigInteger SEIZURE_TOLERANCE_DENOMINATOR = BigInteger.valueOf(10_000);

    private EngineParameters() {
    }
}
