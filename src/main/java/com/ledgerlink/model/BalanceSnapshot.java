package com.ledgerlink.model;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "balance_snapshots", uniqueConstraints = {
    @UniqueConstraint(name = "uk_snapshot_account_date", columnNames = {"account_id", "snapshot_date"})
})
@Getter
@Setter
public class BalanceSnapshot {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "account_id", nullable = false)
  private UUID accountId;

  @Column(name = "snapshot_date", nullable = false)
  private LocalDate snapshotDate;

  @Embedded
  @AttributeOverrides({
      @AttributeOverride(name = "amount", column = @Column(name = "current_balance", nullable = false)),
      @AttributeOverride(name = "currency", column = @Column(name = "current_currency", nullable = false, length = 16))
  })
  private MoneyColumns currentBalance;

  @Embedded
  @AttributeOverrides({
      @AttributeOverride(name = "amount", column = @Column(name = "available_balance", nullable = false)),
      @AttributeOverride(name = "currency", column = @Column(name = "available_currency", nullable = false, length = 16))
  })
  private MoneyColumns availableBalance;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private SnapshotType snapshotType;

  @Column(nullable = false)
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (createdAt == null) {
      createdAt = Instant.now();
    }
    updatedAt = createdAt;
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }
}
