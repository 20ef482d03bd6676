package com.synthetic.issuance.domain.error;

public class ReentrancyException extends IssuanceException {

    public ReentrancyException(String operation) {
        super(ErrorCategory.REENTRANCY, ErrorCode.REENTRANT_CALL, "re-entrant call rejected: " + operation, null);
    }
}
