package com.synthetic.issuance.infra.disruptor.handler;

import com.lmax.disruptor.ExceptionHandler;
import com.synthetic.issuance.domain.model.LedgerEvent;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlot;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Journal and broadcast failures never reach the engine: the operation has already committed when
 * its events are published. The failed event is logged with enough detail to replay it by hand
 * and counted per event type; the pipeline keeps going.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerPipelineExceptionHandler implements ExceptionHandler<LedgerEventSlot> {

    static final String FAILURE_METRIC = "disruptor.ledger.failures";

    private final MeterRegistry meterRegistry;

    @Override
    public void handleEventException(Throwable ex, long sequence, LedgerEventSlot slot) {
        LedgerEvent event = slot == null ? null : slot.getEvent();
        String type = event == null ? "unknown" : event.getType().name();
        meterRegistry.counter(FAILURE_METRIC, "type", type).increment();

        if (event == null) {
            log.error("[Disruptor-ledger] 빈 슬롯 처리 예외: seq={}", sequence, ex);
            return;
        }
        log.error("[Disruptor-ledger] 원장 이벤트 처리 실패, 드롭: seq={}, type={}, user={}, counterparty={}, asset={}, amount={}, ts={}",
                sequence, type, event.getUser(), event.getCounterparty(), event.getAsset(),
                event.getAmount(), event.getTimestamp(), ex);
    }

    @Override
    public void handleOnStartException(Throwable ex) {
        log.error("[Disruptor-ledger] 핸들러 시작 예외", ex);
    }

    @Override
    public void handleOnShutdownException(Throwable ex) {
        log.error("[Disruptor-ledger] 핸들러 종료 예외", ex);
    }
}
