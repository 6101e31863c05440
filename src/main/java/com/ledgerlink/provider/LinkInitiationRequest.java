package com.ledgerlink.provider;

import java.util.Map;
import java.util.UUID;

/**
 * @param providerUserDetails provider-specific data stored on the user (e.g. a provider user token),
 *     merged with whatever the client supplied for this link attempt
 */
public record LinkInitiationRequest(UUID userId, String redirectUri, Map<String, Object> providerUserDetails) {
  public LinkInitiationRequest {
    providerUserDetails = providerUserDetails == null ? Map.of() : Map.copyOf(providerUserDetails);
  }
}
