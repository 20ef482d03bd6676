package com.synthetic.issuance.infra.feed.scheduler;

import com.synthetic.issuance.domain.model.CollateralAsset;
import com.synthetic.issuance.domain.service.CollateralRegistry;
import com.synthetic.issuance.infra.feed.PolledPriceFeed;
import com.synthetic.issuance.infra.feed.client.BinanceMarkPriceClient;
import com.synthetic.issuance.infra.feed.config.PriceFeedProperties;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

/**
 * Refreshes every {@link PolledPriceFeed} found in the collateral registry. A failed poll keeps
 * the previous answer, which then ages until the oracle treats it as stale.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PriceFeedPoller {

    private final BinanceMarkPriceClient client;
    private final PriceFeedProperties properties;
    private final CollateralRegistry registry;

    @PostConstruct
    void init() {
        if (properties.isEnabled()) {
            pollPrices();
        } else {
            log.info("[FeedPoller] 비활성화됨 - 가격 피드가 갱신되지 않습니다");
        }
    }

    @Scheduled(fixedDelayString = "${issuance.feed.poll-interval-ms:10000}")
    public void pollPrices() {
        if (!properties.isEnabled()) return;

        for (PolledPriceFeed feed : polledFeeds()) {
            try {
                client.getMarkPrice(feed.marketSymbol()).ifPresentOrElse(index -> {
                    if (index.getMarkPrice() == null) {
                        log.warn("[FeedPoller] markPrice 누락: symbol={}", feed.marketSymbol());
                        return;
                    }
                    boolean updated = feed.update(index.getMarkPrice(), Instant.ofEpochMilli(index.getTime()));
                    log.debug("[FeedPoller] 갱신: symbol={}, price={}, updated={}",
                            feed.marketSymbol(), index.getMarkPrice(), updated);
                }, () -> log.warn("[FeedPoller] 응답 없음, 이전 가격 유지: symbol={}, updatedAt={}",
                        feed.marketSymbol(), feed.latestQuote().updatedAt()));
            } catch (Exception e) {
                log.warn("[FeedPoller] 폴링 실패: symbol={}", feed.marketSymbol(), e);
            }
        }
    }

    private List<PolledPriceFeed> polledFeeds() {
        return registry.assets().stream()
                .map(CollateralAsset::priceFeed)
                .filter(PolledPriceFeed.class::isInstance)
                .map(PolledPriceFeed.class::cast)
                .toList();
    }
}
