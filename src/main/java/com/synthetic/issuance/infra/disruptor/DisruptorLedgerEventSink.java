package com.synthetic.issuance.infra.disruptor;

import com.lmax.disruptor.EventTranslatorOneArg;
import com.lmax.disruptor.RingBuffer;
import com.synthetic.issuance.domain.model.LedgerEvent;
import com.synthetic.issuance.domain.service.LedgerEventSink;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class DisruptorLedgerEventSink implements LedgerEventSink {

    private static final EventTranslatorOneArg<LedgerEventSlot, LedgerEvent> TRANSLATOR = (slot, seq, event) -> {
        slot.clear();
        slot.setEvent(event);
        slot.setPublishNanoTime(System.nanoTime());
    };

    private final RingBuffer<LedgerEventSlot> ledgerEventRingBuffer;

    @Override
    public void publish(LedgerEvent event) {
        if (!ledgerEventRingBuffer.tryPublishEvent(TRANSLATOR, event)) {
            log.warn("[Disruptor] 링버퍼 포화, 이벤트 드롭: type={}, user={}", event.getType(), event.getUser());
        }
    }
}
