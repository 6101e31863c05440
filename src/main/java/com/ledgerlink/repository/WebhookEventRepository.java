package com.ledgerlink.repository;

import com.ledgerlink.model.WebhookEvent;
import com.ledgerlink.model.WebhookEventStatus;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WebhookEventRepository extends JpaRepository<WebhookEvent, UUID> {
  Optional<WebhookEvent> findByWebhookId(String webhookId);

  Optional<WebhookEvent> findByWebhookIdAndStatus(String webhookId, WebhookEventStatus status);

  boolean existsByWebhookIdStartingWithAndStatusAndCompletedAtGreaterThanEqual(
      String webhookIdPrefix, WebhookEventStatus status, Instant cutoff);

  /** Conditional status flip; returns 1 for the single caller that moved the record, 0 otherwise. */
  @Modifying(clearAutomatically = true, flushAutomatically = true)
  @Query("update WebhookEvent e " +
      "set e.status = :claimed, e.updatedAt = :now " +
      "where e.webhookId = :webhookId and e.status = :pending " +
      "and (e.expiresAt is null or e.expiresAt > :now)")
  int claimPending(@Param("webhookId") String webhookId,
                   @Param("pending") WebhookEventStatus pending,
                   @Param("claimed") WebhookEventStatus claimed,
                   @Param("now") Instant now);
}
