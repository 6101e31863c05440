package com.ledgerlink.service;

import com.ledgerlink.event.LinkedAccountCreatedEvent;
import com.ledgerlink.event.LinkedAccountState;
import com.ledgerlink.event.LinkedAccountUpdatedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/** Records a SYNC snapshot whenever a provider sync creates or refreshes an account. */
@Component
public class BalanceSnapshotListener {
  private static final Logger log = LoggerFactory.getLogger(BalanceSnapshotListener.class);

  private final BalanceSnapshotService snapshotService;

  public BalanceSnapshotListener(BalanceSnapshotService snapshotService) {
    this.snapshotService = snapshotService;
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onAccountCreated(LinkedAccountCreatedEvent event) {
    record(event.account());
  }

  @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
  public void onAccountUpdated(LinkedAccountUpdatedEvent event) {
    record(event.account());
  }

  private void record(LinkedAccountState account) {
    try {
      snapshotService.recordSync(account);
    } catch (RuntimeException ex) {
      log.error("Failed to record sync snapshot for account {}", account.accountId(), ex);
    }
  }
}
