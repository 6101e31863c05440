package com.ledgerlink.provider;

/** How a provider's links are kept fresh outside of explicit user syncs. */
public enum SyncCadence {
  /** Refreshed by provider update webhooks; skipped by system-wide syncs. */
  WEBHOOK,
  DAILY,
  HOURLY
}
