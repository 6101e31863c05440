package com.ledgerlink.model;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "bank_links", indexes = {
    @Index(name = "idx_bank_links_user", columnList = "user_id"),
    @Index(name = "idx_bank_links_item", columnList = "external_item_id")
})
@Getter
@Setter
public class BankLink {
  @Id
  private UUID id;

  @Column(name = "user_id", nullable = false)
  private UUID userId;

  @Column(nullable = false, length = 64)
  private String providerName;

  @Column(columnDefinition = "text")
  private String encryptedAuthentication;

  @Column(name = "external_item_id")
  private String externalItemId;

  @ElementCollection(fetch = FetchType.EAGER)
  @CollectionTable(name = "bank_link_accounts", joinColumns = @JoinColumn(name = "bank_link_id"))
  @Column(name = "external_account_id", nullable = false)
  private Set<String> accountIds = new LinkedHashSet<>();

  @Column
  private String institutionId;

  @Column
  private String institutionName;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 32)
  private BankLinkStatus status;

  @Column
  private Instant statusDate;

  @Column(columnDefinition = "text")
  private String statusBody;

  @Column(nullable = false)
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (status == null) {
      status = BankLinkStatus.OK;
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
