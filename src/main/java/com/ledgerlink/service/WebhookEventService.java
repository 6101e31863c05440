package com.ledgerlink.service;

import com.ledgerlink.config.WebhookProperties;
import com.ledgerlink.dto.WindowedClaim;
import com.ledgerlink.model.WebhookEvent;
import com.ledgerlink.model.WebhookEventStatus;
import com.ledgerlink.repository.WebhookEventRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persistent record of provider callbacks. Supports two dedup styles: pre-registered correlation
 * ids (a PENDING record created when a link starts, claimed by exactly one delivery and then
 * resolved to COMPLETED or FAILED) and a sliding time window keyed on
 * {@code provider:eventType:itemId} for callbacks that carry no unique id.
 *
 * <p>The window check and the record insert are not atomic: two identical callbacks racing inside
 * the same millisecond window can both be accepted. Downstream syncs are idempotent, so the cost
 * is an extra provider call.
 */
@Service
public class WebhookEventService {
  private static final Logger log = LoggerFactory.getLogger(WebhookEventService.class);

  private final WebhookEventRepository webhookEventRepository;
  private final Duration dedupWindow;
  private final Clock clock;

  public WebhookEventService(WebhookEventRepository webhookEventRepository,
                             WebhookProperties properties,
                             Clock clock) {
    this.webhookEventRepository = webhookEventRepository;
    this.dedupWindow = properties.dedupWindow();
    this.clock = clock;
  }

  @Transactional
  public WebhookEvent createPending(String webhookId, String providerName, UUID userId, Instant expiresAt) {
    WebhookEvent event = new WebhookEvent();
    event.setWebhookId(webhookId);
    event.setProviderName(providerName);
    event.setUserId(userId);
    event.setStatus(WebhookEventStatus.PENDING);
    event.setExpiresAt(expiresAt);
    WebhookEvent saved = webhookEventRepository.save(event);
    log.info("Registered pending webhook {} for provider {} user {}", webhookId, providerName, userId);
    return saved;
  }

  /** PENDING record for the id, unless it has expired; an expired record is treated as absent. */
  @Transactional(readOnly = true)
  public Optional<WebhookEvent> findPendingByWebhookId(String webhookId) {
    Instant now = clock.instant();
    return webhookEventRepository.findByWebhookIdAndStatus(webhookId, WebhookEventStatus.PENDING)
        .filter(event -> {
          boolean live = event.getExpiresAt() == null || event.getExpiresAt().isAfter(now);
          if (!live) {
            log.warn("Pending webhook {} expired at {}", webhookId, event.getExpiresAt());
          }
          return live;
        });
  }

  /**
   * Moves a live PENDING record to PROCESSING in one conditional update. When the same callback is
   * delivered concurrently only one delivery gets {@code true}; the others must not act on it.
   */
  @Transactional
  public boolean claimPending(String webhookId) {
    boolean claimed = webhookEventRepository.claimPending(webhookId, WebhookEventStatus.PENDING,
        WebhookEventStatus.PROCESSING, clock.instant()) == 1;
    if (!claimed) {
      log.info("Webhook {} is no longer pending, another delivery claimed it", webhookId);
    }
    return claimed;
  }

  @Transactional
  public Optional<WebhookEvent> markCompleted(String webhookId, String payload) {
    return webhookEventRepository.findByWebhookId(webhookId).map(event -> {
      if (event.isTerminal()) {
        log.info("Webhook {} already {}, not marking completed", webhookId, event.getStatus());
        return event;
      }
      event.setStatus(WebhookEventStatus.COMPLETED);
      event.setWebhookContent(payload);
      event.setCompletedAt(clock.instant());
      return webhookEventRepository.save(event);
    });
  }

  @Transactional
  public Optional<WebhookEvent> markFailed(String webhookId, String errorMessage, String payload) {
    return webhookEventRepository.findByWebhookId(webhookId).map(event -> {
      if (event.isTerminal()) {
        log.info("Webhook {} already {}, not marking failed", webhookId, event.getStatus());
        return event;
      }
      event.setStatus(WebhookEventStatus.FAILED);
      event.setErrorMessage(errorMessage);
      event.setWebhookContent(payload);
      event.setCompletedAt(clock.instant());
      return webhookEventRepository.save(event);
    });
  }

  /**
   * Accepts at most one {@code provider:eventType:itemId} callback per dedup window, recording each
   * accepted one as a COMPLETED event keyed {@code provider:eventType:itemId:epochMillis}.
   */
  @Transactional
  public WindowedClaim claimWindowed(String providerName, String eventType, String itemId, UUID userId, String payload) {
    String baseKey = providerName + ":" + eventType + ":" + itemId;
    Instant now = clock.instant();
    Instant cutoff = now.minus(dedupWindow);
    if (webhookEventRepository.existsByWebhookIdStartingWithAndStatusAndCompletedAtGreaterThanEqual(
        baseKey + ":", WebhookEventStatus.COMPLETED, cutoff)) {
      String reason = "Already processed " + eventType + " for item " + itemId
          + " within the last " + dedupWindow.toMinutes() + " minutes";
      log.info("Skipping duplicate webhook {}: {}", baseKey, reason);
      return WindowedClaim.reject(reason);
    }
    WebhookEvent event = new WebhookEvent();
    event.setWebhookId(baseKey + ":" + now.toEpochMilli());
    event.setProviderName(providerName);
    event.setUserId(userId);
    event.setStatus(WebhookEventStatus.COMPLETED);
    event.setWebhookContent(payload);
    event.setCompletedAt(now);
    webhookEventRepository.save(event);
    return WindowedClaim.accept();
  }
}
