package com.synthetic.issuance.infra.feed.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.synthetic.issuance.infra.feed.config.PriceFeedProperties;
import com.synthetic.issuance.infra.feed.dto.PremiumIndexResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Slf4j
@Component
@RequiredArgsConstructor
public class BinanceMarkPriceClient {

    private final OkHttpClient okHttpClient;
    private final PriceFeedProperties properties;
    private final ObjectMapper objectMapper;

    public Optional<PremiumIndexResponse> getMarkPrice(String symbol) {
        String url = properties.getRestBaseUrl()
                + "/fapi/v1/premiumIndex?symbol=" + symbol.toUpperCase();

        Request request = new Request.Builder().url(url).get().build();

        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                log.warn("[Feed REST] markPrice 요청 실패: symbol={}, code={}", symbol, response.code());
                return Optional.empty();
            }

            ResponseBody body = response.body();
            if (body == null) return Optional.empty();

            PremiumIndexResponse index = objectMapper.readValue(body.string(), PremiumIndexResponse.class);
            log.debug("[Feed REST] markPrice 수신: symbol={}, markPrice={}, time={}",
                    symbol, index.getMarkPrice(), index.getTime());
            return Optional.of(index);

        } catch (Exception e) {
            log.error("[Feed REST] markPrice 요청 예외: symbol={}", symbol, e);
            return Optional.empty();
        }
    }
}
