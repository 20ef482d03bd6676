package com.synthetic.issuance.infra.disruptor.config;

import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlot;
import com.synthetic.issuance.infra.disruptor.event.LedgerEventSlotFactory;
import com.synthetic.issuance.infra.disruptor.handler.JournalEventHandler;
import com.synthetic.issuance.infra.disruptor.handler.LedgerBroadcastHandler;
import com.synthetic.issuance.infra.disruptor.handler.LedgerPipelineExceptionHandler;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class LedgerEventDisruptorConfig {

    private static final int LEDGER_BUFFER_SIZE = 1024 * 16;

    private final JournalEventHandler journalEventHandler;
    private final LedgerBroadcastHandler ledgerBroadcastHandler;
    private final MeterRegistry meterRegistry;
    private final Environment environment;

    private Disruptor<LedgerEventSlot> ledgerDisruptor;

    @Bean
    public Disruptor<LedgerEventSlot> ledgerEventDisruptor() {
        WaitStrategy waitStrategy = resolveWaitStrategy();

        // REST threads publish, serialized by the engine lock but not always the same thread
        ledgerDisruptor = new Disruptor<>(
                new LedgerEventSlotFactory(),
                LEDGER_BUFFER_SIZE,
                namedThreadFactory("disruptor-ledger"),
                ProducerType.MULTI,
                waitStrategy
        );

        ledgerDisruptor.setDefaultExceptionHandler(new LedgerPipelineExceptionHandler(meterRegistry));

        ledgerDisruptor.handleEventsWith(journalEventHandler, ledgerBroadcastHandler);
        ledgerDisruptor.start();

        log.info("[Disruptor] Ledger 파이프라인 기동: LedgerEvent → (Journal || STOMP Broadcast) | size={}, wait={}",
                LEDGER_BUFFER_SIZE, waitStrategy.getClass().getSimpleName());

        return ledgerDisruptor;
    }

    @Bean
    public RingBuffer<LedgerEventSlot> ledgerEventRingBuffer(Disruptor<LedgerEventSlot> ledgerEventDisruptor) {
        RingBuffer<LedgerEventSlot> ringBuffer = ledgerEventDisruptor.getRingBuffer();
        Gauge.builder("disruptor.ringbuffer.remaining", ringBuffer, rb -> (double) rb.remainingCapacity())
                .tag("pipeline", "ledger")
                .description("Ledger RingBuffer remaining capacity")
                .register(meterRegistry);
        return ringBuffer;
    }

    @PreDestroy
    public void shutdown() {
        if (ledgerDisruptor != null) {
            ledgerDisruptor.shutdown();
            log.info("[Disruptor] Ledger Disruptor 종료 완료");
        }
    }

    private WaitStrategy resolveWaitStrategy() {
        for (String profile : environment.getActiveProfiles()) {
            if ("prod".equals(profile)) {
                return new YieldingWaitStrategy();
            }
        }
        return new SleepingWaitStrategy();
    }

    private ThreadFactory namedThreadFactory(String prefix) {
        AtomicInteger counter = new AtomicInteger(0);
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
