package com.synthetic.issuance.domain.error;

/**
 * A token collaborator refused a transfer, mint or burn. Everything done before the refusal has
 * been reversed by the time this reaches the caller.
 */
public class TransferException extends IssuanceException {

    private final String symbol;

    public TransferException(ErrorCode code, String symbol, String message) {
        this(code, symbol, message, null);
    }

    public TransferException(ErrorCode code, String symbol, String message, Throwable cause) {
        super(ErrorCategory.TRANSFER, code, message, cause);
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }
}
