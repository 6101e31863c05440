package com.ledgerlink.provider;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Optional;

/** Provider reports link health changes (errors, re-authentication) through webhooks. */
public interface StatusWebhookSupport {
  Optional<StatusWebhook> parseStatusWebhook(JsonNode payload);
}
