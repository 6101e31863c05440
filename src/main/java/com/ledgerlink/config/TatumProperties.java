package com.ledgerlink.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledgerlink.providers.tatum")
public record TatumProperties(
    @DefaultValue("https://api.tatum.io") String baseUrl,
    String apiKey,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("20s") Duration readTimeout) {}
