package com.ledgerlink.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledgerlink.webhooks")
public record WebhookProperties(
    @DefaultValue("5m") Duration dedupWindow,
    String baseUrl) {}
