package com.ledgerlink.event;

import com.ledgerlink.model.AccountTransaction;
import com.ledgerlink.model.MoneyWithSign;
import java.time.LocalDate;
import java.util.UUID;

/** Immutable copy of the balance-relevant fields of a transaction at event time. */
public record TransactionState(UUID transactionId, UUID userId, UUID accountId, MoneyWithSign amount, LocalDate date) {
  public static TransactionState of(AccountTransaction transaction) {
    return new TransactionState(
        transaction.getId(),
        transaction.getUserId(),
        transaction.getAccountId(),
        transaction.getAmount().toMoney(),
        transaction.getDate());
  }
}
