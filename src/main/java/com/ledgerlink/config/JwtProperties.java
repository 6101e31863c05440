package com.ledgerlink.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "ledgerlink.jwt")
public record JwtProperties(String secret, String issuer) {}
