package com.synthetic.issuance.infra.disruptor.handler;

import com.synthetic.issuance.domain.model.LedgerEvent;
import com.synthetic.issuance.domain.model.LedgerEventRecord;
import com.synthetic.issuance.domain.model.LedgerEventType;
import com.synthetic.issuance.domain.repository.LedgerEventRepository;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class JournalEventHandlerTest {

    private final LedgerEventRepository repository = mock(LedgerEventRepository.class);
    private final JournalEventHandler handler = new JournalEventHandler(repository);

    private static LedgerEventSlot slot(LedgerEventType type, String user, BigInteger amount) {
        LedgerEventSlot slot = new LedgerEventSlot();
        slot.setEvent(LedgerEvent.builder()
                .type(type)
                .user(user)
                .asset("WETH")
                .amount(amount)
                .timestamp(1_000L)
                .build());
        return slot;
    }

    @Test
    @DisplayName("events are saved once per batch")
    @SuppressWarnings("unchecked")
    void savesPerBatch() {
        List<List<LedgerEventRecord>> saved = new ArrayList<>();
        when(repository.saveAll(anyList())).thenAnswer(inv -> {
            saved.add(new ArrayList<>((List<LedgerEventRecord>) inv.getArgument(0)));
            return List.of();
        });

        handler.onEvent(slot(LedgerEventType.COLLATERAL_DEPOSITED, "alice", BigInteger.TEN), 0, false);
        verify(repository, never()).saveAll(anyList());
        handler.onEvent(slot(LedgerEventType.DEBT_MINTED, "alice", new BigInteger("1" + "0".repeat(40))), 1, true);

        assertEquals(1, saved.size());
        List<LedgerEventRecord> batch = saved.get(0);
        assertEquals(2, batch.size());
        assertEquals(LedgerEventType.COLLATERAL_DEPOSITED, batch.get(0).getType());
        assertEquals("alice", batch.get(0).getUserId());
        assertEquals("1" + "0".repeat(40), batch.get(1).getAmount());
        assertEquals(1_000L, batch.get(1).getTimestampEpochMs());
    }

    @Test
    @DisplayName("a failed save is logged and the next batch starts empty")
    void failureDoesNotPropagate() {
        List<Integer> batchSizes = new ArrayList<>();
        when(repository.saveAll(anyList()))
                .thenThrow(new IllegalStateException("db down"))
                .thenAnswer(inv -> {
                    batchSizes.add(((List<?>) inv.getArgument(0)).size());
                    return List.of();
                });

        assertDoesNotThrow(() ->
                handler.onEvent(slot(LedgerEventType.DEBT_BURNED, "bob", BigInteger.ONE), 0, true));
        handler.onEvent(slot(LedgerEventType.DEBT_BURNED, "carol", BigInteger.ONE), 1, true);

        verify(repository, times(2)).saveAll(anyList());
        assertEquals(List.of(1), batchSizes);
    }
}
