package com.synthetic.issuance.domain.error;

public enum ErrorCode {

    NEEDS_MORE_THAN_ZERO(ErrorCategory.VALIDATION),
    TOKEN_NOT_ALLOWED(ErrorCategory.VALIDATION),
    CONFIGURATION_LENGTH_MISMATCH(ErrorCategory.VALIDATION),
    DUPLICATE_ASSET(ErrorCategory.VALIDATION),
    INSUFFICIENT_BALANCE(ErrorCategory.VALIDATION),
    INVALID_ACCOUNT(ErrorCategory.VALIDATION),

    BREAKS_HEALTH_FACTOR(ErrorCategory.INVARIANT_VIOLATION),

    INVALID_PRICE(ErrorCategory.ORACLE),
    STALE_PRICE(ErrorCategory.ORACLE),

    TRANSFER_FAILED(ErrorCategory.TRANSFER),
    MINT_FAILED(ErrorCategory.TRANSFER),
    BURN_FAILED(ErrorCategory.TRANSFER),

    HEALTH_FACTOR_OK(ErrorCategory.LIQUIDATION),
    INSUFFICIENT_COLLATERAL(ErrorCategory.LIQUIDATION),

    REENTRANT_CALL(ErrorCategory.REENTRANCY);

    private final ErrorCategory category;

    ErrorCode(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }
}
