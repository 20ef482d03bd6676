package com.synthetic.issuance.domain.error;

/**
 * Base of every failure raised by the engine. A thrown {@code IssuanceException} means the
 * operation left no trace in the ledger.
 */
public abstract class IssuanceException extends RuntimeException {

    private final ErrorCode code;

    protected IssuanceException(ErrorCategory expected, ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        if (code.category() != expected) {
            throw new IllegalArgumentException(code + " belongs to " + code.category() + ", not " + expected);
        }
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }

    public ErrorCategory getCategory() {
        return code.category();
    }
}
