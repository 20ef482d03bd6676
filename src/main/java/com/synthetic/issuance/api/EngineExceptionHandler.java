package com.synthetic.issuance.api;

import com.synthetic.issuance.domain.error.ErrorCategory;
import com.synthetic.issuance.domain.error.IssuanceException;
import com.synthetic.issuance.domain.error.OracleException;
import com.synthetic.issuance.domain.error.TransferException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class EngineExceptionHandler {

    @ExceptionHandler(IssuanceException.class)
    public ResponseEntity<Map<String, Object>> handle(IssuanceException e) {
        HttpStatus status = statusOf(e.getCategory());
        log.debug("[API] 엔진 거부 응답: status={}, code={}", status.value(), e.getCode());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", false);
        body.put("code", e.getCode().name());
        body.put("category", e.getCategory().name());
        body.put("message", e.getMessage());
        if (e instanceof OracleException oracle) {
            body.put("asset", oracle.getAssetId());
        } else if (e instanceof TransferException transfer) {
            body.put("token", transfer.getSymbol());
        }
        return ResponseEntity.status(status).body(body);
    }

    static HttpStatus statusOf(ErrorCategory category) {
        return switch (category) {
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case INVARIANT_VIOLATION, LIQUIDATION -> HttpStatus.UNPROCESSABLE_ENTITY;
            case ORACLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case TRANSFER -> HttpStatus.BAD_GATEWAY;
            case REENTRANCY -> HttpStatus.CONFLICT;
        };
    }
}
