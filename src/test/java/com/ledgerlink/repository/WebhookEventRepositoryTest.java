package com.ledgerlink.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.ledgerlink.model.WebhookEvent;
import com.ledgerlink.model.WebhookEventStatus;
import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

@DataJpaTest
@DisplayName("WebhookEventRepository")
class WebhookEventRepositoryTest {
  private static final Instant NOW = Instant.parse("2024-01-15T12:00:00Z");
  private static final String PREFIX = "plaid:update-TRANSACTIONS:item_1:";

  @Autowired
  private WebhookEventRepository webhookEventRepository;

  private void completed(String webhookId, Instant completedAt) {
    WebhookEvent event = new WebhookEvent();
    event.setWebhookId(webhookId);
    event.setProviderName("plaid");
    event.setStatus(WebhookEventStatus.COMPLETED);
    event.setCompletedAt(completedAt);
    webhookEventRepository.saveAndFlush(event);
  }

  private boolean seenSince(String prefix, Instant cutoff) {
    return webhookEventRepository.existsByWebhookIdStartingWithAndStatusAndCompletedAtGreaterThanEqual(
        prefix, WebhookEventStatus.COMPLETED, cutoff);
  }

  @Test
  @DisplayName("Should find a completed event inside the window")
  void findsEventInsideWindow() {
    completed(PREFIX + NOW.minusSeconds(120).toEpochMilli(), NOW.minusSeconds(120));

    assertThat(seenSince(PREFIX, NOW.minus(Duration.ofMinutes(5)))).isTrue();
    assertThat(seenSince(PREFIX, NOW.minus(Duration.ofMinutes(1)))).isFalse();
  }

  @Test
  @DisplayName("Should not match another item sharing the prefix characters")
  void prefixIsExact() {
    completed("plaid:update-TRANSACTIONS:item_10:" + NOW.toEpochMilli(), NOW);
    completed("plaid:update-TRANSACTIONS:itemX1:" + NOW.toEpochMilli(), NOW);

    assertThat(seenSince(PREFIX, NOW.minus(Duration.ofMinutes(5)))).isFalse();
  }

  @Test
  @DisplayName("Should ignore pending and failed events")
  void onlyCompletedCounts() {
    WebhookEvent failed = new WebhookEvent();
    failed.setWebhookId(PREFIX + "1");
    failed.setProviderName("plaid");
    failed.setStatus(WebhookEventStatus.FAILED);
    failed.setCompletedAt(NOW);
    webhookEventRepository.saveAndFlush(failed);

    assertThat(seenSince(PREFIX, NOW.minus(Duration.ofMinutes(5)))).isFalse();
    assertThat(webhookEventRepository.findByWebhookIdAndStatus(PREFIX + "1", WebhookEventStatus.PENDING)).isEmpty();
    assertThat(webhookEventRepository.findByWebhookId(PREFIX + "1")).isPresent();
  }

  private void pending(String webhookId, Instant expiresAt) {
    WebhookEvent event = new WebhookEvent();
    event.setWebhookId(webhookId);
    event.setProviderName("plaid");
    event.setStatus(WebhookEventStatus.PENDING);
    event.setExpiresAt(expiresAt);
    webhookEventRepository.saveAndFlush(event);
  }

  private int claim(String webhookId) {
    return webhookEventRepository.claimPending(webhookId, WebhookEventStatus.PENDING,
        WebhookEventStatus.PROCESSING, NOW);
  }

  @Test
  @DisplayName("Should let only the first claim move a pending event")
  void pendingIsClaimedOnce() {
    pending("link-1", NOW.plusSeconds(600));

    assertThat(claim("link-1")).isEqualTo(1);
    assertThat(claim("link-1")).isZero();
    assertThat(webhookEventRepository.findByWebhookId("link-1"))
        .get()
        .extracting(WebhookEvent::getStatus)
        .isEqualTo(WebhookEventStatus.PROCESSING);
  }

  @Test
  @DisplayName("Should not claim an expired pending event")
  void expiredPendingIsNotClaimed() {
    pending("link-2", NOW.minusSeconds(1));

    assertThat(claim("link-2")).isZero();
    assertThat(claim("unknown")).isZero();
  }
}
