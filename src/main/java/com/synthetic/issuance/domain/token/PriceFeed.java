package com.synthetic.issuance.domain.token;

import com.synthetic.issuance.domain.model.PriceQuote;

public interface PriceFeed {

    PriceQuote latestQuote();

    String description();
}
