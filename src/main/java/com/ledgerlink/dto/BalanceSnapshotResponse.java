package com.ledgerlink.dto;

import com.ledgerlink.model.BalanceSnapshot;
import com.ledgerlink.model.MoneyWithSign;
import com.ledgerlink.model.SnapshotType;
import java.time.LocalDate;
import java.util.UUID;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class BalanceSnapshotResponse {
  private UUID id;
  private UUID accountId;
  private LocalDate snapshotDate;
  private MoneyWithSign currentBalance;
  private MoneyWithSign availableBalance;
  private SnapshotType snapshotType;

  public static BalanceSnapshotResponse from(BalanceSnapshot snapshot) {
    return new BalanceSnapshotResponse(
        snapshot.getId(),
        snapshot.getAccountId(),
        snapshot.getSnapshotDate(),
        snapshot.getCurrentBalance().toMoney(),
        snapshot.getAvailableBalance().toMoney(),
        snapshot.getSnapshotType());
  }
}
