package com.ledgerlink.dto;

public enum WebhookOutcome {
  STATUS_UPDATED,
  SYNCED,
  LINK_COMPLETED,
  LINK_FAILED,
  DUPLICATE,
  IGNORED
}
