package com.synthetic.issuance.domain.model;

public enum LedgerEventType {
    COLLATERAL_DEPOSITED,
    COLLATERAL_REDEEMED,
    DEBT_MINTED,
    DEBT_BURNED,
    POSITION_LIQUIDATED
}
