package com.ledgerlink.service;

import com.ledgerlink.event.TransactionState;
import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.SnapshotType;
import com.ledgerlink.repository.BalanceSnapshotRepository;
import com.ledgerlink.repository.FinancialAccountRepository;
import java.time.LocalDate;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps account balances and daily snapshots consistent with user-entered transactions.
 *
 * <p>Each operation runs in its own transaction: the account row and every affected snapshot row
 * change together or not at all. Balances move through a single relative {@code UPDATE}, so
 * concurrent adjustments on one account serialize on its row lock and none is lost. "Today" is
 * the account owner's local date.
 */
@Service
public class BalanceLedgerService {
  private static final Logger log = LoggerFactory.getLogger(BalanceLedgerService.class);

  private final FinancialAccountRepository accountRepository;
  private final BalanceSnapshotRepository snapshotRepository;
  private final BalanceSnapshotService snapshotService;

  public BalanceLedgerService(FinancialAccountRepository accountRepository,
                              BalanceSnapshotRepository snapshotRepository,
                              BalanceSnapshotService snapshotService) {
    this.accountRepository = accountRepository;
    this.snapshotRepository = snapshotRepository;
    this.snapshotService = snapshotService;
  }

  /**
   * Adds the transaction to the account. Snapshots from the transaction date up to yesterday shift
   * by the same amount; today's snapshot is rewritten from the updated account as USER_UPDATE.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void applyCreated(TransactionState transaction) {
    long delta = transaction.amount().signedAmount();
    LocalDate today = snapshotService.today(transaction.userId());
    FinancialAccount account = shiftAccount(transaction.transactionId(), transaction.accountId(), delta);
    LocalDate yesterday = today.minusDays(1);
    if (!transaction.date().isAfter(yesterday)) {
      snapshotRepository.shiftRange(transaction.accountId(), transaction.date(), yesterday, delta);
    }
    snapshotService.upsert(account, today, SnapshotType.USER_UPDATE);
    log.info("Applied transaction {} ({} minor units) to account {}", transaction.transactionId(), delta,
        transaction.accountId());
  }

  /**
   * Reverses the transaction on the account and on every snapshot from its date through today. A
   * future-dated transaction was counted in today's snapshot when created, so today is reversed too.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void applyDeleted(TransactionState transaction) {
    long delta = -transaction.amount().signedAmount();
    LocalDate today = snapshotService.today(transaction.userId());
    shiftAccount(transaction.transactionId(), transaction.accountId(), delta);
    int snapshots = snapshotRepository.shiftRange(transaction.accountId(), notAfter(transaction.date(), today),
        today, delta);
    log.info("Reversed transaction {} on account {} and {} snapshots", transaction.transactionId(),
        transaction.accountId(), snapshots);
  }

  /**
   * Applies the difference between the two versions. A move between accounts reverses the old
   * amount on the old account and applies the new amount on the new one.
   */
  @Transactional(propagation = Propagation.REQUIRES_NEW)
  public void applyUpdated(TransactionState previous, TransactionState current) {
    if (!previous.accountId().equals(current.accountId())) {
      LocalDate today = snapshotService.today(current.userId());
      shiftAccountAndSnapshots(previous.transactionId(), previous.accountId(), notAfter(previous.date(), today),
          today, -previous.amount().signedAmount());
      shiftAccountAndSnapshots(current.transactionId(), current.accountId(), notAfter(current.date(), today),
          today, current.amount().signedAmount());
      log.info("Moved transaction {} from account {} to {}", current.transactionId(), previous.accountId(),
          current.accountId());
      return;
    }
    long delta = current.amount().signedAmount() - previous.amount().signedAmount();
    if (delta == 0) {
      return;
    }
    LocalDate today = snapshotService.today(current.userId());
    LocalDate from = notAfter(previous.date().isBefore(current.date()) ? previous.date() : current.date(), today);
    shiftAccountAndSnapshots(current.transactionId(), current.accountId(), from, today, delta);
    log.info("Adjusted account {} by {} for updated transaction {}", current.accountId(), delta,
        current.transactionId());
  }

  private static LocalDate notAfter(LocalDate date, LocalDate today) {
    return date.isAfter(today) ? today : date;
  }

  private void shiftAccountAndSnapshots(UUID transactionId, UUID accountId, LocalDate from, LocalDate to, long delta) {
    shiftAccount(transactionId, accountId, delta);
    snapshotRepository.shiftRange(accountId, from, to, delta);
  }

  private FinancialAccount shiftAccount(UUID transactionId, UUID accountId, long delta) {
    if (accountRepository.applyBalanceDelta(accountId, delta) != 1) {
      throw new BalanceDriftException(transactionId, "Account " + accountId + " not found");
    }
    return accountRepository.findById(accountId)
        .orElseThrow(() -> new BalanceDriftException(transactionId, "Account " + accountId + " vanished"));
  }
}
