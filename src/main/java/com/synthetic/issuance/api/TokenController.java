package com.synthetic.issuance.api;

import com.synthetic.issuance.infra.config.IssuanceProperties;
import com.synthetic.issuance.infra.token.InMemoryToken;
import com.synthetic.issuance.infra.token.TokenDirectory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.Map;
import java.util.Optional;

/**
 * Development helpers for the in-process tokens: allowances towards the engine, balances and an
 * optional faucet.
 */
@Slf4j
@RestController
@RequestMapping("/api/tokens")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class TokenController {

    private final TokenDirectory tokens;
    private final IssuanceProperties properties;

    @PostMapping("/{symbol}/approve")
    public ResponseEntity<Map<String, Object>> approve(@PathVariable String symbol, @RequestBody AllowanceRequest req) {
        Optional<InMemoryToken> token = tokens.find(symbol);
        if (token.isEmpty()) return unknown(symbol);
        if (req.amount() == null || req.amount().signum() < 0) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "amount는 0 이상이어야 합니다"));
        }

        token.get().approve(req.owner(), properties.getCustodyAccount(), req.amount());
        log.info("[Token API] approve: symbol={}, owner={}, amount={}", token.get().symbol(), req.owner(), req.amount());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "symbol", token.get().symbol(),
                "spender", properties.getCustodyAccount(),
                "allowance", req.amount().toString()));
    }

    @PostMapping("/{symbol}/faucet")
    public ResponseEntity<Map<String, Object>> faucet(@PathVariable String symbol, @RequestBody FaucetRequest req) {
        if (!properties.isFaucetEnabled()) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of(
                    "success", false,
                    "message", "faucet이 비활성화되어 있습니다"));
        }
        Optional<InMemoryToken> token = tokens.find(symbol);
        if (token.isEmpty()) return unknown(symbol);
        if (token.get() == tokens.synthetic()) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "합성 토큰은 엔진을 통해서만 발행됩니다"));
        }
        if (req.amount() == null || req.amount().signum() <= 0) {
            return ResponseEntity.badRequest().body(Map.of(
                    "success", false,
                    "message", "amount는 0보다 커야 합니다"));
        }

        token.get().faucet(req.to(), req.amount());
        return ResponseEntity.ok(Map.of(
                "success", true,
                "symbol", token.get().symbol(),
                "balance", token.get().balanceOf(req.to()).toString()));
    }

    @GetMapping("/{symbol}/balance")
    public ResponseEntity<Map<String, Object>> balance(@PathVariable String symbol, @RequestParam String account) {
        Optional<InMemoryToken> token = tokens.find(symbol);
        if (token.isEmpty()) return unknown(symbol);
        return ResponseEntity.ok(Map.of(
                "symbol", token.get().symbol(),
                "account", account,
                "balance", token.get().balanceOf(account).toString(),
                "totalSupply", token.get().totalSupply().toString()));
    }

    private static ResponseEntity<Map<String, Object>> unknown(String symbol) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of(
                "success", false,
                "symbol", symbol,
                "message", "등록되지 않은 토큰입니다"));
    }

    public record AllowanceRequest(String owner, BigInteger amount) {
    }

    public record FaucetRequest(String to, BigInteger amount) {
    }
}
