package com.synthetic.issuance.infra.disruptor.handler;

import com.synthetic.issuance.domain.model.LedgerEvent;
import com.synthetic.issuance.domain.model.LedgerEventType;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.math.BigInteger;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

class LedgerBroadcastHandlerTest {

    private final SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
    private final LedgerBroadcastHandler handler = new LedgerBroadcastHandler(template);

    private static LedgerEventSlot slot(LedgerEventType type) {
        LedgerEventSlot slot = new LedgerEventSlot();
        slot.setEvent(LedgerEvent.builder()
                .type(type)
                .user("alice")
                .counterparty("bob")
                .amount(BigInteger.TEN)
                .timestamp(5L)
                .build());
        return slot;
    }

    @Test
    @DisplayName("ledger events go to the user's topic only")
    void userTopic() {
        handler.onEvent(slot(LedgerEventType.DEBT_MINTED), 0, true);

        verify(template).convertAndSend(eq("/topic/ledger/alice"), argThat((Object payload) ->
                payload instanceof Map<?, ?> map
                        && "DEBT_MINTED".equals(map.get("type"))
                        && "10".equals(map.get("amount"))));
        verify(template, never()).convertAndSend(eq(LedgerBroadcastHandler.LIQUIDATION_TOPIC), any(Object.class));
    }

    @Test
    @DisplayName("liquidations are also pushed to the liquidation topic")
    void liquidationTopic() {
        handler.onEvent(slot(LedgerEventType.POSITION_LIQUIDATED), 0, true);

        verify(template).convertAndSend(eq(LedgerBroadcastHandler.LEDGER_TOPIC + "alice"), any(Object.class));
        verify(template).convertAndSend(eq(LedgerBroadcastHandler.LIQUIDATION_TOPIC), any(Object.class));
    }

    @Test
    @DisplayName("empty slot is skipped")
    void emptySlot() {
        handler.onEvent(new LedgerEventSlot(), 0, true);
        verifyNoInteractions(template);
    }
}
