package com.synthetic.issuance.infra.monitor;

import com.synthetic.issuance.infra.config.IssuanceProperties;
import com.synthetic.issuance.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.simp.SimpMessagingTemplate;

import java.util.List;

import static com.synthetic.issuance.support.EngineFixture.NOW;
import static com.synthetic.issuance.support.EngineFixture.ether;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class LiquidationWatcherTest {

    private final EngineFixture f = new EngineFixture();
    private final IssuanceProperties properties = new IssuanceProperties();
    private final SimpMessagingTemplate template = mock(SimpMessagingTemplate.class);
    private final LiquidationWatcher watcher = new LiquidationWatcher(f.engine, properties, template);

    @Test
    @DisplayName("unhealthy positions are published and kept as the latest scan")
    void publishesUnhealthyPositions() {
        f.fund(f.weth, "alice", ether(10));
        f.engine.depositCollateralAndMintDebt("alice", "WETH", ether(10), ether(10_000));
        f.wethFeed.setPrice(1_500, NOW);

        watcher.scan();

        assertEquals(List.of("alice"), watcher.latest().stream().map(p -> p.user()).toList());
        verify(template).convertAndSend(eq(LiquidationWatcher.LIQUIDATABLE_TOPIC),
                argThat((Object payload) -> payload instanceof List<?> list && list.size() == 1));
    }

    @Test
    @DisplayName("disabled watcher does nothing")
    void disabled() {
        properties.getWatcher().setEnabled(false);

        watcher.scan();

        verify(template, never()).convertAndSend(anyString(), any(Object.class));
        assertTrue(watcher.latest().isEmpty());
    }
}
