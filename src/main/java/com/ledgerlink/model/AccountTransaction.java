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
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "account_transactions")
@Getter
@Setter
public class AccountTransaction {
  private static final int DEFAULT_VARCHAR_LIMIT = 255;

  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(name = "account_id", nullable = false)
  private UUID accountId;

  @Embedded
  @AttributeOverrides({
      @AttributeOverride(name = "amount", column = @Column(name = "amount", nullable = false)),
      @AttributeOverride(name = "currency", column = @Column(name = "currency", nullable = false, length = 16))
  })
  private MoneyColumns amount;

  @Column(name = "transaction_date", nullable = false)
  private LocalDate date;

  @Column
  private String merchantName;

  @Column(columnDefinition = "text")
  private String description;

  @Column(nullable = false)
  private boolean pending;

  @Column(length = 512)
  private String externalTransactionId;

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
    merchantName = truncate(merchantName, DEFAULT_VARCHAR_LIMIT);
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
    merchantName = truncate(merchantName, DEFAULT_VARCHAR_LIMIT);
  }

  private static String truncate(String value, int max) {
    if (value == null || value.length() <= max) {
      return value;
    }
    return value.substring(0, max);
  }
}
