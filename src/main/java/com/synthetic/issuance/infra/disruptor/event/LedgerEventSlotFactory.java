package com.synthetic.issuance.infra.disruptor.event;

import com.lmax.disruptor.EventFactory;

public class LedgerEventSlotFactory implements EventFactory<LedgerEventSlot> {

    @Override
    public LedgerEventSlot newInstance() {
        return new LedgerEventSlot();
    }
}
