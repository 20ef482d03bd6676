package com.synthetic.issuance.infra.disruptor.handler;

import com.lmax.disruptor.EventHandler;
import com.synthetic.issuance.domain.model.LedgerEvent;
import com.synthetic.issuance.domain.model.LedgerEventType;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class LedgerBroadcastHandler implements EventHandler<LedgerEventSlot> {

    static final String LEDGER_TOPIC = "/topic/ledger/";
    static final String LIQUIDATION_TOPIC = "/topic/liquidations";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onEvent(LedgerEventSlot slot, long sequence, boolean endOfBatch) {
        LedgerEvent event = slot.getEvent();
        if (event == null || event.getUser() == null) return;

        Map<String, Object> payload = toPayload(event);
        messagingTemplate.convertAndSend(LEDGER_TOPIC + event.getUser(), payload);

        if (event.getType() == LedgerEventType.POSITION_LIQUIDATED) {
            messagingTemplate.convertAndSend(LIQUIDATION_TOPIC, payload);
        }

        log.debug("[Broadcast] {} → user={}, amount={}, latency={}μs",
                event.getType(), event.getUser(), event.getAmount(),
                (System.nanoTime() - slot.getPublishNanoTime()) / 1_000);
    }

    private static Map<String, Object> toPayload(LedgerEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("type", event.getType().name());
        payload.put("user", event.getUser());
        payload.put("counterparty", event.getCounterparty());
        payload.put("asset", event.getAsset());
        payload.put("amount", event.getAmount().toString());
        payload.put("timestamp", event.getTimestamp());
        return payload;
    }
}
