package com.synthetic.issuance.api;

import com.synthetic.issuance.domain.service.IssuanceEngine;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Map;

@RestController
@RequestMapping("/api/oracle")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class OracleController {

    private final IssuanceEngine engine;

    @GetMapping("/usd-value")
    public ResponseEntity<Map<String, Object>> usdValue(@RequestParam String asset, @RequestParam BigInteger amount) {
        return ResponseEntity.ok(Map.of(
                "asset", asset.toUpperCase(),
                "amount", amount.toString(),
                "usdValue", engine.usdValue(asset, amount).toString()));
    }

    @GetMapping("/token-amount")
    public ResponseEntity<Map<String, Object>> tokenAmount(@RequestParam String asset, @RequestParam BigInteger usd) {
        return ResponseEntity.ok(Map.of(
                "asset", asset.toUpperCase(),
                "usd", usd.toString(),
                "amount", engine.tokenAmountFromUsd(asset, usd).toString()));
    }
}
