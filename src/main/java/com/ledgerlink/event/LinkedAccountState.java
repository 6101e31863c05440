package com.ledgerlink.event;

import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyWithSign;
import java.util.UUID;

public record LinkedAccountState(
    UUID accountId,
    UUID userId,
    UUID bankLinkId,
    String externalAccountId,
    MoneyWithSign currentBalance,
    MoneyWithSign availableBalance) {

  public static LinkedAccountState of(FinancialAccount account) {
    return new LinkedAccountState(
        account.getId(),
        account.getUserId(),
        account.getBankLinkId(),
        account.getExternalAccountId(),
        account.getCurrentBalance().toMoney(),
        account.getAvailableBalance().toMoney());
  }
}
