package com.synthetic.issuance.domain.service;

import com.synthetic.issuance.domain.model.LedgerEvent;

@FunctionalInterface
public interface LedgerEventSink {

    LedgerEventSink NO_OP = event -> { };

    void publish(LedgerEvent event);
}
