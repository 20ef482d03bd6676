package com.synthetic.issuance.api;

import com.synthetic.issuance.domain.model.EngineParameters;
import com.synthetic.issuance.domain.model.LiquidationResult;
import com.synthetic.issuance.domain.service.IssuanceEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/engine")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class EngineController {

    private final IssuanceEngine engine;

    @PostMapping("/deposit")
    public ResponseEntity<Map<String, Object>> deposit(@RequestBody CollateralRequest req) {
        engine.depositCollateral(req.user(), req.asset(), req.amount());
        return ok(req.user(), "담보가 예치되었습니다.");
    }

    @PostMapping("/deposit-and-mint")
    public ResponseEntity<Map<String, Object>> depositAndMint(@RequestBody CollateralDebtRequest req) {
        engine.depositCollateralAndMintDebt(req.user(), req.asset(), req.collateralAmount(), req.debtAmount());
        return ok(req.user(), "담보 예치 및 발행이 완료되었습니다.");
    }

    @PostMapping("/redeem")
    public ResponseEntity<Map<String, Object>> redeem(@RequestBody CollateralRequest req) {
        engine.redeemCollateral(req.user(), req.asset(), req.amount());
        return ok(req.user(), "담보가 인출되었습니다.");
    }

    @PostMapping("/redeem-for-debt")
    public ResponseEntity<Map<String, Object>> redeemForDebt(@RequestBody CollateralDebtRequest req) {
        engine.redeemCollateralForDebt(req.user(), req.asset(), req.collateralAmount(), req.debtAmount());
        return ok(req.user(), "부채 상환 및 담보 인출이 완료되었습니다.");
    }

    @PostMapping("/mint")
    public ResponseEntity<Map<String, Object>> mint(@RequestBody DebtRequest req) {
        engine.mintDebt(req.user(), req.amount());
        return ok(req.user(), "발행이 완료되었습니다.");
    }

    @PostMapping("/burn")
    public ResponseEntity<Map<String, Object>> burn(@RequestBody DebtRequest req) {
        engine.burnDebt(req.user(), req.amount());
        return ok(req.user(), "소각이 완료되었습니다.");
    }

    @PostMapping("/liquidate")
    public ResponseEntity<Map<String, Object>> liquidate(@RequestBody LiquidationRequest req) {
        log.info("[Engine API] 청산 요청: liquidator={}, user={}, debtToCover={}",
                req.liquidator(), req.user(), req.debtToCover());

        LiquidationResult result = engine.liquidate(req.liquidator(), req.user(), req.debtToCover());

        List<Map<String, String>> seized = result.getSeized().stream()
                .map(part -> Map.of(
                        "asset", part.asset(),
                        "amount", part.amount().toString(),
                        "usdValue", part.usdValue().toString()))
                .toList();

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.put("user", result.getUser());
        body.put("liquidator", result.getLiquidator());
        body.put("debtCovered", result.getDebtCovered().toString());
        body.put("valueToSeize", result.getValueToSeize().toString());
        body.put("valueSeized", result.getValueSeized().toString());
        body.put("seized", seized);
        body.put("startingHealthFactor", result.getStartingHealthFactor().toString());
        body.put("endingHealthFactor", result.getEndingHealthFactor().toString());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/parameters")
    public ResponseEntity<Map<String, Object>> parameters() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("precision", EngineParameters.PRECISION.toString());
        body.put("additionalFeedPrecision", EngineParameters.ADDITIONAL_FEED_PRECISION.toString());
        body.put("liquidationThreshold", EngineParameters.LIQUIDATION_THRESHOLD.intValue());
        body.put("liquidationBonus", EngineParameters.LIQUIDATION_BONUS.intValue());
        body.put("liquidationPrecision", EngineParameters.LIQUIDATION_PRECISION.intValue());
        body.put("maxLiquidationCloseFactor", EngineParameters.MAX_LIQUIDATION_CLOSE_FACTOR.intValue());
        body.put("minHealthFactor", EngineParameters.MIN_HEALTH_FACTOR.toString());
        body.put("stalenessTimeoutSeconds", EngineParameters.STALENESS_TIMEOUT.toSeconds());
        body.put("syntheticToken", engine.syntheticToken().symbol());
        body.put("custodyAccount", engine.custodyAccount());
        return ResponseEntity.ok(body);
    }

    private static ResponseEntity<Map<String, Object>> ok(String user, String message) {
        return ResponseEntity.ok(Map.of(
                "success", true,
                "user", user,
                "message", message));
    }

    public record CollateralRequest(String user, String asset, BigInteger amount) {
    }

    public record CollateralDebtRequest(String user, String asset, BigInteger collateralAmount,
                                        BigInteger debtAmount) {
    }

    public record DebtRequest(String user, BigInteger amount) {
    }

    public record LiquidationRequest(String liquidator, String user, BigInteger debtToCover) {
    }
}
