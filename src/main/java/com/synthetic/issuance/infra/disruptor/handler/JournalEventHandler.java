package com.synthetic.issuance.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.synthetic.issuance.domain.model.LedgerEvent;
import com.synthetic.issuance.domain.model.LedgerEventRecord;
import com.synthetic.issuance.domain.repository.LedgerEventRepository;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Appends committed ledger events to the {@code ledger_event} table, one {@code saveAll} per
 * Disruptor batch.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JournalEventHandler implements EventHandler<LedgerEventSlot> {

    private final LedgerEventRepository ledgerEventRepository;

    private final List<LedgerEventRecord> pending = new ArrayList<>();

    @Override
    public void onEvent(LedgerEventSlot slot, long sequence, boolean endOfBatch) {
        LedgerEvent event = slot.getEvent();
        if (event != null) {
            pending.add(LedgerEventRecord.from(event));
        }

        if (endOfBatch) {
            flush();
        }
    }

    private void flush() {
        if (pending.isEmpty()) return;

        try {
            ledgerEventRepository.saveAll(pending);
            log.debug("[Journal] 배치 저장 완료: events={}", pending.size());
        } catch (Exception e) {
            log.error("[Journal] 원장 이벤트 저장 실패: events={}", pending.size(), e);
        } finally {
            pending.clear();
        }
    }
}
