package com.synthetic.issuance.domain.error;

/** Bad input: unknown asset, zero amount, overdraw, bad configuration. */
public class ValidationException extends IssuanceException {

    public ValidationException(ErrorCode code, String message) {
        super(ErrorCategory.VALIDATION, code, message, null);
    }
}
