package com.synthetic.issuance.infra.feed.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

@Getter
@NoArgsConstructor
@AllArgsConstructor
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
public class PremiumIndexResponse {

    private String symbol;
    private BigDecimal markPrice;
    private BigDecimal indexPrice;
    private long time;
}
