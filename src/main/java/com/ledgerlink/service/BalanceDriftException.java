package com.ledgerlink.service;

import java.util.UUID;

/** A balance adjustment could not be applied; the account and its snapshots were left as they were. */
public class BalanceDriftException extends RuntimeException {
  private final UUID transactionId;

  public BalanceDriftException(UUID transactionId, String message, Throwable cause) {
    super(message, cause);
    this.transactionId = transactionId;
  }

  public BalanceDriftException(UUID transactionId, String message) {
    super(message);
    this.transactionId = transactionId;
  }

  public UUID getTransactionId() {
    return transactionId;
  }
}
