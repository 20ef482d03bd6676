package com.synthetic.issuance.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Table(name = "ledger_event", indexes = {
        @Index(name = "idx_ledger_event_user", columnList = "userId"),
        @Index(name = "idx_ledger_event_timestamp", columnList = "timestampEpochMs")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEventRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    private LedgerEventType type;

    private String userId;
    private String counterparty;
    private String asset;

    // uint256-sized values do not fit a numeric column
    @Column(length = 80)
    private String amount;

    private long timestampEpochMs;

    public static LedgerEventRecord from(LedgerEvent event) {
        return LedgerEventRecord.builder()
                .type(event.getType())
                .userId(event.getUser())
                .counterparty(event.getCounterparty())
                .asset(event.getAsset())
                .amount(event.getAmount().toString())
                .timestampEpochMs(event.getTimestamp())
                .build();
    }
}
