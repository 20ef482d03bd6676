package com.synthetic.issuance.infra.config;

import com.synthetic.issuance.domain.error.ErrorCode;
import com.synthetic.issuance.domain.error.ValidationException;
import com.synthetic.issuance.domain.service.CollateralLedger;
import com.synthetic.issuance.domain.service.CollateralRegistry;
import com.synthetic.issuance.domain.service.CollateralSeizer;
import com.synthetic.issuance.domain.service.CustodyGateway;
import com.synthetic.issuance.domain.service.HealthFactorCalculator;
import com.synthetic.issuance.domain.service.IssuanceEngine;
import com.synthetic.issuance.domain.service.LedgerEventSink;
import com.synthetic.issuance.domain.service.LiquidationEngine;
import com.synthetic.issuance.domain.service.PriceOracleAdapter;
import com.synthetic.issuance.domain.service.ReentrancyGuard;
import com.synthetic.issuance.infra.feed.PolledPriceFeed;
import com.synthetic.issuance.infra.token.InMemoryToken;
import com.synthetic.issuance.infra.token.TokenDirectory;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class EngineConfig {

    private final IssuanceProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TokenDirectory tokenDirectory() {
        InMemoryToken synthetic = new InMemoryToken(properties.getSyntheticSymbol(), properties.getCustodyAccount());
        List<InMemoryToken> collateralTokens = new ArrayList<>();
        for (IssuanceProperties.Asset asset : properties.getAssets()) {
            collateralTokens.add(new InMemoryToken(asset.getId().toUpperCase(), properties.getCustodyAccount()));
        }
        return new TokenDirectory(synthetic, collateralTokens);
    }

    @Bean
    public CollateralRegistry collateralRegistry(TokenDirectory tokens) {
        List<String> ids = new ArrayList<>();
        List<PolledPriceFeed> feeds = new ArrayList<>();
        for (IssuanceProperties.Asset asset : properties.getAssets()) {
            if (asset.getId() == null || asset.getFeedSymbol() == null) {
                throw new ValidationException(ErrorCode.CONFIGURATION_LENGTH_MISMATCH,
                        "asset and feed must be configured in pairs: id=" + asset.getId()
                                + ", feedSymbol=" + asset.getFeedSymbol());
            }
            ids.add(asset.getId());
            feeds.add(new PolledPriceFeed(asset.getFeedSymbol()));
        }
        CollateralRegistry registry = CollateralRegistry.of(ids, tokens.collateralTokens(), feeds);
        log.info("[EngineConfig] 담보 자산 등록: assets={}, custody={}", registry.ids(), properties.getCustodyAccount());
        return registry;
    }

    @Bean
    public CustodyGateway custodyGateway(TokenDirectory tokens) {
        return new CustodyGateway(properties.getCustodyAccount(), tokens.synthetic());
    }

    @Bean
    public LiquidationEngine liquidationEngine(CollateralRegistry registry,
                                               CollateralLedger ledger,
                                               HealthFactorCalculator healthFactorCalculator,
                                               CollateralSeizer seizer,
                                               CustodyGateway custodyGateway) {
        return new LiquidationEngine(registry, ledger, healthFactorCalculator, seizer, custodyGateway);
    }

    @Bean
    public IssuanceEngine issuanceEngine(CollateralRegistry registry,
                                         CollateralLedger ledger,
                                         PriceOracleAdapter oracle,
                                         HealthFactorCalculator healthFactorCalculator,
                                         LiquidationEngine liquidationEngine,
                                         CustodyGateway custodyGateway,
                                         ReentrancyGuard guard,
                                         LedgerEventSink ledgerEventSink,
                                         Clock clock,
                                         MeterRegistry meterRegistry) {
        return new IssuanceEngine(registry, ledger, oracle, healthFactorCalculator, liquidationEngine,
                custodyGateway, guard, ledgerEventSink, clock, meterRegistry);
    }
}
