package com.ledgerlink.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledgerlink.sync")
public record SyncProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("2m") Duration linkTimeout,
    @DefaultValue("4") int parallelism,
    @DefaultValue("false") boolean backfillItemIdsOnStartup) {}
