package com.synthetic.issuance.domain.error;

/**
 * The feed answer cannot be used to size a transfer. Carries the asset so callers can tell which
 * feed needs attention.
 */
public class OracleException extends IssuanceException {

    private final String assetId;

    public OracleException(ErrorCode code, String assetId, String message) {
        super(ErrorCategory.ORACLE, code, message, null);
        this.assetId = assetId;
    }

    public String getAssetId() {
        return assetId;
    }
}
