package com.ledgerlink.model;

public enum WebhookEventStatus {
  PENDING,
  PROCESSING,
  COMPLETED,
  FAILED
}
