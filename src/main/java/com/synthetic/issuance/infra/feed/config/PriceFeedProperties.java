package com.synthetic.issuance.infra.feed.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "issuance.feed")
public class PriceFeedProperties {

    private String restBaseUrl = "https://fapi.binance.com";

    private long pollIntervalMs = 10_000;

    private boolean enabled = true;
}
