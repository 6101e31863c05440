package com.ledgerlink.dto;

import com.ledgerlink.model.AccountTransaction;
import com.ledgerlink.model.MoneyWithSign;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class TransactionResponse {
  private UUID id;
  private UUID accountId;
  private MoneyWithSign amount;
  private LocalDate date;
  private String merchantName;
  private String description;
  private boolean pending;

  public static TransactionResponse from(AccountTransaction transaction) {
    return new TransactionResponse(
        transaction.getId(),
        transaction.getAccountId(),
        transaction.getAmount().toMoney(),
        transaction.getDate(),
        transaction.getMerchantName(),
        transaction.getDescription(),
        transaction.isPending());
  }
}
