package com.soko.marketplaceservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "soko.marketplace")
public class MarketplaceProperties {

    /**
     * Currency label used in seller and buyer notification texts.
     */
    private String currency = "RWF";

    /**
     * Upper bound for page sizes on paginated listings.
     */
    private int maxPageSize = 100;
}
