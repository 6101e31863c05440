package com.ledgerlink.dto;

import java.util.List;
import java.util.UUID;

public record WebhookResult(WebhookOutcome outcome, String detail, List<UUID> bankLinkIds) {
  public static WebhookResult of(WebhookOutcome outcome, String detail) {
    return new WebhookResult(outcome, detail, List.of());
  }
}
