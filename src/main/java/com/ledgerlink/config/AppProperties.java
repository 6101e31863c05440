package com.ledgerlink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgerlink.app")
public record AppProperties(String frontendUrl) {}
