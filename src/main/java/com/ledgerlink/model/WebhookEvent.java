package com.ledgerlink.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import java.time.Instant;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;

@Entity
@Table(name = "webhook_events", indexes = {
    @Index(name = "idx_webhook_events_status_completed", columnList = "status, completed_at")
})
@Getter
@Setter
public class WebhookEvent {
  @Id
  private UUID id;

  @Column(name = "user_id")
  private UUID userId;

  @Column(name = "webhook_id", nullable = false, unique = true, length = 512)
  private String webhookId;

  @Column(nullable = false, length = 64)
  private String providerName;

  @Enumerated(EnumType.STRING)
  @Column(nullable = false, length = 16)
  private WebhookEventStatus status;

  @Column(columnDefinition = "text")
  private String webhookContent;

  @Column
  private Instant expiresAt;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(columnDefinition = "text")
  private String errorMessage;

  @Version
  private long version;

  @Column(nullable = false)
  private Instant createdAt;

  @Column
  private Instant updatedAt;

  /** COMPLETED or FAILED. A PROCESSING record can still be resolved by the delivery that claimed it. */
  public boolean isTerminal() {
    return status == WebhookEventStatus.COMPLETED || status == WebhookEventStatus.FAILED;
  }

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = UUID.randomUUID();
    }
    if (status == null) {
      status = WebhookEventStatus.PENDING;
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
