package com.ledgerlink.service;

import com.ledgerlink.config.BalanceLedgerProperties;
import com.ledgerlink.config.BalanceLedgerProperties.FailurePolicy;
import com.ledgerlink.event.TransactionCreatedEvent;
import com.ledgerlink.event.TransactionDeletedEvent;
import com.ledgerlink.event.TransactionUpdatedEvent;
import java.time.Duration;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Feeds committed transaction changes into the {@link BalanceLedgerService}. A failed adjustment
 * leaves the transaction committed; what happens next depends on the configured failure policy.
 */
@Component
public class TransactionBalanceListener {
  private static final Logger log = LoggerFactory.getLogger(TransactionBalanceListener.class);

  private final BalanceLedgerService ledgerService;
  private final FailurePolicy failurePolicy;
  private final int maxAttempts;
  private final Duration retryBackoff;

  public TransactionBalanceListener(BalanceLedgerService ledgerService, BalanceLedgerProperties properties) {
    this.ledgerService = ledgerService;
    this.failurePolicy = properties.failurePolicy();
    this.maxAttempts = properties.failurePolicy() == FailurePolicy.RETRY ? Math.max(1, properties.retryAttempts()) : 1;
    this.retryBackoff = properties.retryBackoff();
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onCreated(TransactionCreatedEvent event) {
    apply("create", event.transaction().transactionId(), () -> ledgerService.applyCreated(event.transaction()));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onUpdated(TransactionUpdatedEvent event) {
    apply("update", event.current().transactionId(),
        () -> ledgerService.applyUpdated(event.previous(), event.current()));
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onDeleted(TransactionDeletedEvent event) {
    apply("delete", event.transaction().transactionId(), () -> ledgerService.applyDeleted(event.transaction()));
  }

  private void apply(String operation, UUID transactionId, Runnable adjustment) {
    for (int attempt = 1; ; attempt++) {
      try {
        adjustment.run();
        return;
      } catch (RuntimeException ex) {
        if (attempt < maxAttempts && pause()) {
          log.warn("Balance {} for transaction {} failed (attempt {}/{}): {}", operation, transactionId, attempt,
              maxAttempts, ex.getMessage());
          continue;
        }
        if (failurePolicy == FailurePolicy.SURFACE) {
          throw new BalanceDriftException(transactionId,
              "Balance " + operation + " failed for transaction " + transactionId, ex);
        }
        log.error("Balance {} for transaction {} failed after {} attempt(s); account and snapshots are out of "
            + "sync with transaction history until the next resync", operation, transactionId, attempt, ex);
        return;
      }
    }
  }

  private boolean pause() {
    try {
      Thread.sleep(retryBackoff.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting to retry a balance adjustment");
      return false;
    }
  }
}
