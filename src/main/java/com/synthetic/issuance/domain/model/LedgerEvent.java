package com.synthetic.issuance.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigInteger;

/**
 * Committed ledger change. {@code user} is the position owner, {@code counterparty} the other side
 * of the movement (redeem recipient, burn payer or liquidator) and is {@code null} when the owner
 * acted alone. {@code asset} is {@code null} for debt events.
 */
@Getter
@Builder
@ToString
public class LedgerEvent {

    private final LedgerEventType type;
    private final String user;
    private final String counterparty;
    private final String asset;
    private final BigInteger amount;
    private final long timestamp;
}
