package com.ledgerlink.dto;

import com.ledgerlink.model.FinancialAccount;
import com.ledgerlink.model.MoneyWithSign;
import java.time.Instant;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class AccountResponse {
  private UUID id;
  private UUID bankLinkId;
  private String name;
  private String mask;
  private String type;
  private String subType;
  private String externalAccountId;
  private MoneyWithSign currentBalance;
  private MoneyWithSign availableBalance;
  private Instant updatedAt;

  public static AccountResponse from(FinancialAccount account) {
    return new AccountResponse(
        account.getId(),
        account.getBankLinkId(),
        account.getName(),
        account.getMask(),
        account.getType(),
        account.getSubType(),
        account.getExternalAccountId(),
        account.getCurrentBalance().toMoney(),
        account.getAvailableBalance().toMoney(),
        account.getUpdatedAt());
  }
}
