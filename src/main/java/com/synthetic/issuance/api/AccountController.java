package com.synthetic.issuance.api;

import com.synthetic.issuance.domain.model.AccountInformation;
import com.synthetic.issuance.domain.service.IssuanceEngine;
import com.synthetic.issuance.domain.service.IssuanceEngine.PositionHealth;
import com.synthetic.issuance.infra.monitor.LiquidationWatcher;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class AccountController {

    private final IssuanceEngine engine;
    private final LiquidationWatcher liquidationWatcher;

    @GetMapping("/account/{user}")
    public ResponseEntity<Map<String, Object>> account(@PathVariable String user) {
        AccountInformation info = engine.accountInformation(user);

        Map<String, String> balances = new LinkedHashMap<>();
        for (String asset : engine.collateralTokens()) {
            balances.put(asset, engine.collateralBalance(user, asset).toString());
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", user);
        body.put("debt", info.debt().toString());
        body.put("collateralValueUsd", info.collateralValueUsd().toString());
        body.put("healthFactor", engine.calculateHealthFactor(info.debt(), info.collateralValueUsd()).toString());
        body.put("collateral", balances);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/account/liquidatable")
    public ResponseEntity<List<Map<String, String>>> liquidatable() {
        List<PositionHealth> positions = liquidationWatcher.latest();
        return ResponseEntity.ok(positions.stream()
                .map(p -> Map.of(
                        "user", p.user(),
                        "debt", p.debt().toString(),
                        "collateralValueUsd", p.collateralValueUsd().toString(),
                        "healthFactor", p.healthFactor().toString()))
                .toList());
    }

    @GetMapping("/collateral")
    public ResponseEntity<List<Map<String, String>>> collateral() {
        return ResponseEntity.ok(engine.collateralTokens().stream()
                .map(asset -> Map.of(
                        "asset", asset,
                        "priceFeed", engine.priceFeed(asset).description()))
                .toList());
    }
}
