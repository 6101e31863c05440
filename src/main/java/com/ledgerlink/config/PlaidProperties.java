package com.ledgerlink.config;

import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledgerlink.providers.plaid")
public record PlaidProperties(
    @DefaultValue("https://sandbox.plaid.com") String baseUrl,
    String clientId,
    String secret,
    @DefaultValue("Ledgerlink") String clientName,
    @DefaultValue("US") List<String> countryCodes,
    @DefaultValue("transactions") List<String> products,
    @DefaultValue("10s") Duration connectTimeout,
    @DefaultValue("30s") Duration readTimeout) {}
