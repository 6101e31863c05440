package com.ledgerlink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgerlink.crypto")
public record CryptoProperties(String secret) {}
