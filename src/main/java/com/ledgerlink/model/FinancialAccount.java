package com.ledgerlink.model;

import jakarta.persistence.AttributeOverride;
import jakarta.persistence.AttributeOverrides;
import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "financial_accounts", uniqueConstraints = {
    @UniqueConstraint(name = "uk_account_user_external", columnNames = {"user_id", "external_account_id"})
})
@Getter
@Setter
public class FinancialAccount {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false)
  private String name;

  @Column(length = 32)
  private String mask;

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

  @Column(length = 64)
  private String type;

  @Column(length = 64)
  private String subType;

  @Column(name = "external_account_id")
  private String externalAccountId;

  @Column(name = "bank_link_id")
  private UUID bankLinkId;

  @Column(columnDefinition = "text")
  private String rawApiAccount;

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
