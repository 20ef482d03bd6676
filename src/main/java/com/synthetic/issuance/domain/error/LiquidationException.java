package com.synthetic.issuance.domain.error;

public class LiquidationException extends IssuanceException {

    public LiquidationException(ErrorCode code, String message) {
        super(ErrorCategory.LIQUIDATION, code, message, null);
    }
}
