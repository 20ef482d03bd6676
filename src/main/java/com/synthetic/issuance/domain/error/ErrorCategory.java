package com.synthetic.issuance.domain.error;

public enum ErrorCategory {
    VALIDATION,
    INVARIANT_VIOLATION,
    ORACLE,
    TRANSFER,
    LIQUIDATION,
    REENTRANCY
}
