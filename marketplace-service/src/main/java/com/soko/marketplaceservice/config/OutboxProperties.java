package com.soko.marketplaceservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Getter
@Setter
@ConfigurationProperties(prefix = "soko.outbox")
public class OutboxProperties {

    // how long processed rows are kept before the nightly cleanup
    private int retentionDays = 1;
}
