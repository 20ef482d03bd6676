package com.synthetic.issuance.infra.monitor;

import com.synthetic.issuance.domain.service.IssuanceEngine;
import com.synthetic.issuance.domain.service.IssuanceEngine.PositionHealth;
import com.synthetic.issuance.infra.config.IssuanceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Periodically lists positions that can be liquidated and pushes the list to
 * {@code /topic/liquidatable}. Read-only: it never liquidates anything itself.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LiquidationWatcher {

    static final String LIQUIDATABLE_TOPIC = "/topic/liquidatable";

    private final IssuanceEngine engine;
    private final IssuanceProperties properties;
    private final SimpMessagingTemplate messagingTemplate;

    private volatile List<PositionHealth> latest = List.of();

    @Scheduled(fixedDelayString = "${issuance.watcher.interval-ms:15000}")
    public void scan() {
        if (!properties.getWatcher().isEnabled()) return;

        try {
            List<PositionHealth> positions = engine.liquidatablePositions();
            latest = positions;

            List<Map<String, String>> payload = positions.stream()
                    .map(p -> Map.of(
                            "user", p.user(),
                            "debt", p.debt().toString(),
                            "collateralValueUsd", p.collateralValueUsd().toString(),
                            "healthFactor", p.healthFactor().toString()))
                    .toList();
            messagingTemplate.convertAndSend(LIQUIDATABLE_TOPIC, payload);

            if (!positions.isEmpty()) {
                log.info("[Watcher] 청산 가능 포지션: count={}, worst={} (hf={})",
                        positions.size(), positions.get(0).user(), positions.get(0).healthFactor());
            }
        } catch (Exception e) {
            log.warn("[Watcher] 스캔 실패", e);
        }
    }

    public List<PositionHealth> latest() {
        return latest;
    }
}
