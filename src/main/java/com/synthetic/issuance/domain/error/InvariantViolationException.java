package com.synthetic.issuance.domain.error;

public class InvariantViolationException extends IssuanceException {

    public InvariantViolationException(ErrorCode code, String message) {
        super(ErrorCategory.INVARIANT_VIOLATION, code, message, null);
    }
}
