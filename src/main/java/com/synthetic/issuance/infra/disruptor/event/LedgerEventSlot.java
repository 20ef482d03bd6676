package com.synthetic.issuance.infra.disruptor.event;

import com.synthetic.issuance.domain.model.LedgerEvent;

public class LedgerEventSlot {

    private LedgerEvent event;
    private long publishNanoTime;

    public void clear() {
        event = null;
        publishNanoTime = 0L;
    }

    public LedgerEvent getEvent() {
        return event;
    }

    public void setEvent(LedgerEvent event) {
        this.event = event;
    }

    public long getPublishNanoTime() {
        return publishNanoTime;
    }

    public void setPublishNanoTime(long publishNanoTime) {
        this.publishNanoTime = publishNanoTime;
    }

    @Override
    public String toString() {
        return "LedgerEventSlot{type=" + (event != null ? event.getType() : "null")
                + ", user=" + (event != null ? event.getUser() : "null") + "}";
    }
}
