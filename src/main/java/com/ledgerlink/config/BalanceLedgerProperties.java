package com.ledgerlink.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "ledgerlink.balance")
public record BalanceLedgerProperties(
    @DefaultValue("SWALLOW") FailurePolicy failurePolicy,
    @DefaultValue("3") int retryAttempts,
    @DefaultValue("200ms") Duration retryBackoff) {

  public enum FailurePolicy {
    SWALLOW,
    RETRY,
    SURFACE
  }
}
