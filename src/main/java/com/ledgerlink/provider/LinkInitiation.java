package com.ledgerlink.provider;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Result of starting a link. Webhook-driven providers return a {@code linkUrl} and the
 * {@code webhookId} their completion callback will carry; synchronous providers return
 * {@code immediateLinks} instead.
 */
public record LinkInitiation(
    String linkUrl,
    Instant expiresAt,
    String webhookId,
    Map<String, Object> updatedProviderUserDetails,
    List<LinkCompletion> immediateLinks) {

  public LinkInitiation {
    immediateLinks = immediateLinks == null ? List.of() : List.copyOf(immediateLinks);
  }

  public static LinkInitiation immediate(List<LinkCompletion> links) {
    return new LinkInitiation(null, null, null, null, links);
  }
}
