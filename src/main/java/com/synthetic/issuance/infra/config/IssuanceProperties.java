package com.synthetic.issuance.infra.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "issuance")
public class IssuanceProperties {

    private String custodyAccount = "issuance-engine";

    private String syntheticSymbol = "SUSD";

    /** Order matters: liquidation seizes in this order. */
    private List<Asset> assets = new ArrayList<>();

    private boolean faucetEnabled = false;

    private Watcher watcher = new Watcher();

    @Getter
    @Setter
    public static class Asset {
        private String id;
        private String feedSymbol;
    }

    @Getter
    @Setter
    public static class Watcher {
        private boolean enabled = true;
        private long intervalMs = 15_000;
    }
}
